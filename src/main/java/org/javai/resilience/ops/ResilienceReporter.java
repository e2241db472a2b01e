package org.javai.resilience.ops;

import org.javai.resilience.Failure;
import org.javai.resilience.circuit.CircuitState;

import java.time.Duration;

/**
 * Receives events from policies for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Policies never log by themselves; they call a reporter, which is a no-op unless one is
 * configured. Reporter methods are invoked on the calling thread and must not block for long.</p>
 */
public interface ResilienceReporter {

    /**
     * Reports a failure raised by a policy: a timeout, a bulkhead rejection or a
     * short-circuited call.
     */
    void report(Failure failure);

    /**
     * Reports a retry about to happen.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that just failed (1-based)
     * @param delay The backoff before the next attempt
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retry attempts have been exhausted.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state transition.
     *
     * @param circuitName The breaker's name
     * @param from The previous state
     * @param to The new state
     */
    default void reportStateTransition(String circuitName, CircuitState from, CircuitState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a fallback replaced a failed result.
     *
     * @param failure The failure that was replaced
     */
    default void reportFallback(Failure failure) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. The default for every policy.
     */
    static ResilienceReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static ResilienceReporter composite(ResilienceReporter... reporters) {
        return CompositeReporter.of(reporters);
    }
}
