package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.Failure;
import org.javai.resilience.FailureKind;
import org.javai.resilience.circuit.CircuitState;
import org.javai.resilience.ops.ResilienceReporter;

import java.time.Duration;
import java.util.Map;

/**
 * Reports resilience events using Log4j2 structured logging.
 *
 * <p>Failures are logged with a level based on their {@link FailureKind}:
 * <ul>
 *   <li>{@code RETRY_EXHAUSTED}, {@code OPERATION_FAILED} → ERROR</li>
 *   <li>{@code TIMEOUT}, {@code BULKHEAD_REJECTED} → WARN</li>
 *   <li>{@code CIRCUIT_OPEN} → DEBUG (one line per short-circuited call would flood the log;
 *       the transition to OPEN is logged separately at WARN)</li>
 * </ul>
 *
 * <p>Each event carries a marker ({@code FAILURE}, {@code RETRY}, {@code RETRY_EXHAUSTED},
 * {@code CIRCUIT}, {@code FALLBACK}) so appenders can route or filter them.
 */
public class Log4jReporter implements ResilienceReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");
	static final Marker FALLBACK_MARKER = MarkerManager.getMarker("FALLBACK");

	private final Logger logger;

	/**
	 * Creates a Log4jReporter using the default logger name.
	 */
	public Log4jReporter() {
		this(LogManager.getLogger("org.javai.resilience.Reporter"));
	}

	/**
	 * Creates a Log4jReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.kind()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry attempt {} failed in [{}], next attempt in {}ms. Code: {}, Message: {}",
				attemptNumber,
				failure.policy(),
				delay.toMillis(),
				failure.code(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted in [{}] after {} attempts. Code: {}, Message: {}",
				failure.policy(),
				totalAttempts,
				failure.code(),
				failure.message());
	}

	@Override
	public void reportStateTransition(String circuitName, CircuitState from, CircuitState to) {
		logger.atLevel(to == CircuitState.OPEN ? Level.WARN : Level.INFO)
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit [{}] {} -> {}", circuitName, from, to);
	}

	@Override
	public void reportFallback(Failure failure) {
		logger.atWarn()
			.withMarker(FALLBACK_MARKER)
			.log("Fallback applied in [{}]. Code: {}, Message: {}",
				failure.policy(),
				failure.code(),
				failure.message());
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure in [%s]: %s \
			| code=%s%s%s\
			""".formatted(
				failure.policy(),
				failure.message(),
				failure.code(),
				formatTags(failure.tags()),
				formatCause(failure.exception())
			).trim();
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static String formatCause(Throwable exception) {
		if (exception == null || exception.getCause() == null) {
			return "";
		}
		return ", cause=" + exception.getCause().getClass().getName();
	}

	static Level levelFor(FailureKind kind) {
		return switch (kind) {
			case RETRY_EXHAUSTED, OPERATION_FAILED -> Level.ERROR;
			case TIMEOUT, BULKHEAD_REJECTED -> Level.WARN;
			case CIRCUIT_OPEN -> Level.DEBUG;
		};
	}
}
