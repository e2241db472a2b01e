package org.javai.resilience.circuit;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable settings of a {@link CircuitBreaker}.
 *
 * @param failureThreshold failures (per {@code window}) that open a closed circuit
 * @param window how failures are counted
 * @param resetTimeout how long the circuit stays open before admitting a trial call
 * @param successThreshold consecutive trial successes that close a half-open circuit
 * @param halfOpenMaxCalls trial calls allowed in flight at once while half-open
 * @param recordFailure which exceptions count as failures of the protected dependency
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        FailureWindow window,
        Duration resetTimeout,
        int successThreshold,
        int halfOpenMaxCalls,
        Predicate<Throwable> recordFailure
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 1;

    private static final CircuitBreakerConfig DEFAULTS = builder().build();

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must not be negative");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, was: " + successThreshold);
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1, was: " + halfOpenMaxCalls);
        }
        Objects.requireNonNull(recordFailure, "recordFailure must not be null");
    }

    /**
     * 5 consecutive failures, 60s reset timeout, 1 trial success, 1 trial at a time,
     * every exception counted.
     */
    public static CircuitBreakerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Consecutive-failure config with the three commonly tuned values.
     */
    public static CircuitBreakerConfig of(int failureThreshold, Duration resetTimeout, int successThreshold) {
        return builder()
                .failureThreshold(failureThreshold)
                .resetTimeout(resetTimeout)
                .successThreshold(successThreshold)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a {@link CircuitBreakerConfig}, starting from the defaults.
     */
    public static final class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private FailureWindow window = FailureWindow.consecutive();
        private Duration resetTimeout = DEFAULT_RESET_TIMEOUT;
        private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
        private int halfOpenMaxCalls = 1;
        private Predicate<Throwable> recordFailure = failure -> true;

        private Builder() {}

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder window(FailureWindow window) {
            this.window = window;
            return this;
        }

        public Builder resetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
            return this;
        }

        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public Builder halfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
            return this;
        }

        /**
         * Sets which exceptions count against the circuit. Exceptions that do not match are
         * rethrown but are neutral for the circuit's state.
         */
        public Builder recordFailure(Predicate<Throwable> recordFailure) {
            this.recordFailure = recordFailure;
            return this;
        }

        /**
         * Excludes exceptions of the given types from the failure count.
         */
        @SafeVarargs
        public final Builder ignore(Class<? extends Throwable>... types) {
            Objects.requireNonNull(types, "types must not be null");
            Class<? extends Throwable>[] ignored = types.clone();
            this.recordFailure = failure -> {
                for (Class<? extends Throwable> type : ignored) {
                    if (type.isInstance(failure)) {
                        return false;
                    }
                }
                return true;
            };
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(failureThreshold, window, resetTimeout,
                    successThreshold, halfOpenMaxCalls, recordFailure);
        }
    }
}
