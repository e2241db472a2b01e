package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry policy after evaluating a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Do not retry.
     *
     * @param reason why the policy gave up
     * @param exhausted true when every allowed attempt was used; false when the failure
     *                  itself is not retryable and must propagate unchanged
     */
    record GiveUp(String reason, boolean exhausted) implements RetryDecision {

        public static GiveUp exhaustedAfter(int attempts) {
            return new GiveUp("max attempts reached (" + attempts + ")", true);
        }

        public static GiveUp notRetryable(Throwable failure) {
            return new GiveUp(failure.getClass().getSimpleName() + " is not retryable", false);
        }
    }
}
