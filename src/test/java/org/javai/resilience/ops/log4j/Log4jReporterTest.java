package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.javai.resilience.BulkheadRejectedException;
import org.javai.resilience.CircuitOpenException;
import org.javai.resilience.Failure;
import org.javai.resilience.FailureKind;
import org.javai.resilience.circuit.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class Log4jReporterTest {

	private static final String LOGGER_NAME = "org.javai.resilience.test.Reporter";

	private CapturingAppender appender;
	private Log4jReporter reporter;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		appender = new CapturingAppender();
		appender.start();
		LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
		loggerConfig.addAppender(appender, Level.ALL, null);
		configuration.addLogger(LOGGER_NAME, loggerConfig);
		context.updateLoggers();
		reporter = new Log4jReporter(LOGGER_NAME);
	}

	@AfterEach
	void tearDown() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		context.getConfiguration().removeLogger(LOGGER_NAME);
		context.updateLoggers();
		appender.stop();
	}

	@Test
	void report_usesKindLevelAndFailureMarker() {
		reporter.report(Failure.of("BulkheadPolicy", new BulkheadRejectedException(3)));

		assertThat(appender.events).singleElement().satisfies(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getMarker()).isEqualTo(Log4jReporter.FAILURE_MARKER);
			assertThat(event.getMessage().getFormattedMessage())
					.startsWith("Failure in [BulkheadPolicy]: Bulkhead saturated")
					.contains("code=resilience:bulkhead_rejected");
		});
	}

	@Test
	void reportStateTransition_toOpen_logsAtWarn() {
		reporter.reportStateTransition("payments", CircuitState.CLOSED, CircuitState.OPEN);
		reporter.reportStateTransition("payments", CircuitState.OPEN, CircuitState.HALF_OPEN);

		assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.WARN, Level.INFO);
		assertThat(appender.events.get(0).getMessage().getFormattedMessage())
				.isEqualTo("Circuit [payments] CLOSED -> OPEN");
		assertThat(appender.events.get(0).getMarker()).isEqualTo(Log4jReporter.CIRCUIT_MARKER);
	}

	@Test
	void reportRetryAttempt_logsAttemptAndDelay() {
		reporter.reportRetryAttempt(Failure.of("api.retry", new IOException("flaky")), 1, Duration.ofMillis(250));

		assertThat(appender.events).singleElement().satisfies(event -> {
			assertThat(event.getMarker()).isEqualTo(Log4jReporter.RETRY_MARKER);
			assertThat(event.getMessage().getFormattedMessage())
					.isEqualTo("Retry attempt 1 failed in [api.retry], next attempt in 250ms. "
							+ "Code: resilience:operation_failed, Message: flaky");
		});
	}

	@Test
	void shortCircuitedCalls_logAtDebug() {
		reporter.report(Failure.of("payments", new CircuitOpenException("payments", CircuitState.OPEN, Duration.ofSeconds(5))));

		assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.DEBUG);
	}

	@Test
	void levelFor_mapsEveryKind() {
		assertThat(Log4jReporter.levelFor(FailureKind.RETRY_EXHAUSTED)).isEqualTo(Level.ERROR);
		assertThat(Log4jReporter.levelFor(FailureKind.OPERATION_FAILED)).isEqualTo(Level.ERROR);
		assertThat(Log4jReporter.levelFor(FailureKind.TIMEOUT)).isEqualTo(Level.WARN);
		assertThat(Log4jReporter.levelFor(FailureKind.BULKHEAD_REJECTED)).isEqualTo(Level.WARN);
		assertThat(Log4jReporter.levelFor(FailureKind.CIRCUIT_OPEN)).isEqualTo(Level.DEBUG);
	}

	private static final class CapturingAppender extends AbstractAppender {
		final List<LogEvent> events = new CopyOnWriteArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, new Property[0]);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
