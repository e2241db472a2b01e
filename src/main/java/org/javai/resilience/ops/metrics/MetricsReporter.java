package org.javai.resilience.ops.metrics;

import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;
import org.javai.resilience.ops.ResilienceReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reports resilience events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for a log shipper feeding a metrics
 * aggregation pipeline. Nothing is pushed anywhere by this class; it only writes log lines.
 * The tracking key is the policy or circuit name, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.RetryPolicy","code":"resilience:timeout",...}
 * {"eventType":"state_transition","timestamp":"2024-01-20T10:30:01Z","trackingKey":"myapp.external_api","from":"CLOSED","to":"OPEN"}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsReporter implements ResilienceReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Supplier<Instant> clock;

	/**
	 * Creates a MetricsReporter with no namespace and the default logger.
	 */
	public MetricsReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Creates a MetricsReporter with explicit configuration.
	 * Package-private for testing.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param logger the SLF4J logger to use
	 */
	MetricsReporter(String namespace, Logger logger) {
		this(namespace, logger, Instant::now);
	}

	MetricsReporter(String namespace, Logger logger, Supplier<Instant> clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(Failure failure) {
		emit(() -> failureJson("failure", failure).toString() + "}");
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		emit(() -> {
			StringBuilder sb = failureJson("retry_attempt", failure);
			appendField(sb, "attemptNumber", String.valueOf(attemptNumber), false);
			appendField(sb, "delayMs", String.valueOf(delay.toMillis()), false);
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		emit(() -> {
			StringBuilder sb = failureJson("retry_exhausted", failure);
			appendField(sb, "totalAttempts", String.valueOf(totalAttempts), false);
			return sb.append("}").toString();
		});
	}

	@Override
	public void reportFallback(Failure failure) {
		emit(() -> failureJson("fallback", failure).toString() + "}");
	}

	@Override
	public void reportStateTransition(String circuitName, CircuitState from, CircuitState to) {
		emit(() -> {
			StringBuilder sb = new StringBuilder("{");
			appendField(sb, "eventType", "state_transition", true);
			appendField(sb, "timestamp", ISO_FORMATTER.format(clock.get()), false);
			appendField(sb, "trackingKey", buildTrackingKey(circuitName), false);
			appendField(sb, "from", from.name(), false);
			appendField(sb, "to", to.name(), false);
			return sb.append("}").toString();
		});
	}

	private void emit(Supplier<String> json) {
		try {
			logger.info(json.get());
		} catch (Exception e) {
			// Reporting should not break the call being reported on
			logger.debug("Failed to emit metrics event", e);
		}
	}

	// Leaves the object open so callers can append event-specific fields.
	private StringBuilder failureJson(String eventType, Failure failure) {
		StringBuilder sb = new StringBuilder("{");
		appendField(sb, "eventType", eventType, true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(failure.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(failure.policy()), false);
		appendField(sb, "code", failure.code(), false);
		appendField(sb, "kind", failure.kind().name(), false);
		appendField(sb, "message", failure.message(), false);
		appendTags(sb, failure.tags());
		return sb;
	}

	String buildTrackingKey(String trackingId) {
		if (namespace == null || namespace.isEmpty()) {
			return trackingId;
		}
		return namespace + "." + trackingId;
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private void appendTags(StringBuilder sb, Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return;
		}
		sb.append(",\"tags\":{");
		boolean first = true;
		for (Map.Entry<String, String> entry : tags.entrySet()) {
			if (!first) {
				sb.append(",");
			}
			sb.append("\"").append(escapeJson(entry.getKey())).append("\":\"")
			  .append(escapeJson(entry.getValue())).append("\"");
			first = false;
		}
		sb.append("}");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
