package org.javai.resilience.ops;

import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link ResilienceReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute. A failing reporter
 * never fails the call being reported on.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResilienceReporter reporter = CompositeReporter.of(
 *     new Log4jReporter(),
 *     new MetricsReporter("myapp")
 * );
 *
 * // Or using the builder for more control:
 * ResilienceReporter reporter = CompositeReporter.builder()
 *     .add(new Log4jReporter())
 *     .addIf(metricsEnabled, new MetricsReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeReporter implements ResilienceReporter {

	private static final Logger LOGGER = LoggerFactory.getLogger(CompositeReporter.class);

	private final List<ResilienceReporter> reporters;

	private CompositeReporter(List<ResilienceReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeReporter of(ResilienceReporter... reporters) {
		return new CompositeReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeReporter of(Collection<? extends ResilienceReporter> reporters) {
		return new CompositeReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void reportStateTransition(String circuitName, CircuitState from, CircuitState to) {
		fanOut("reportStateTransition", reporter -> reporter.reportStateTransition(circuitName, from, to));
	}

	@Override
	public void reportFallback(Failure failure) {
		fanOut("reportFallback", reporter -> reporter.reportFallback(failure));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<ResilienceReporter> call) {
		for (ResilienceReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				LOGGER.warn("ResilienceReporter.{} failed for {}: {}",
						method, reporter.getClass().getName(), e.getMessage(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeReporter}.
	 */
	public static final class Builder {
		private final List<ResilienceReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null is ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(ResilienceReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds multiple reporters to the composite.
		 *
		 * @param reporters the reporters to add
		 * @return this builder
		 */
		public Builder addAll(Collection<? extends ResilienceReporter> reporters) {
			for (ResilienceReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, ResilienceReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Builds the composite reporter.
		 *
		 * @return the composite reporter
		 */
		public CompositeReporter build() {
			return new CompositeReporter(reporters);
		}
	}
}
