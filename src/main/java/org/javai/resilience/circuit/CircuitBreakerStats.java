package org.javai.resilience.circuit;

import java.time.Instant;

/**
 * A point-in-time snapshot of a breaker's state and counters, for an external observability
 * collaborator to poll. All fields are read under the breaker's lock, so they are mutually
 * consistent.
 *
 * @param name the breaker's name
 * @param state current state
 * @param failureCount failures counted towards the threshold (closed state)
 * @param successCount consecutive trial successes (half-open state)
 * @param halfOpenInFlight trial calls currently running
 * @param openedAt when the circuit last opened, or null if it never has
 * @param lastTransitionAt when the state last changed
 * @param totalCalls calls admitted since creation or last reset
 * @param totalSuccesses admitted calls that succeeded
 * @param totalFailures admitted calls that failed and were counted
 * @param totalRejections calls short-circuited without invoking the work
 * @param timesOpened how many times the circuit has opened
 */
public record CircuitBreakerStats(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        int halfOpenInFlight,
        Instant openedAt,
        Instant lastTransitionAt,
        long totalCalls,
        long totalSuccesses,
        long totalFailures,
        long totalRejections,
        long timesOpened
) {

    /**
     * Share of admitted calls that failed, between 0.0 and 1.0. Zero before any call.
     */
    public double failureRate() {
        long completed = totalSuccesses + totalFailures;
        return completed == 0 ? 0.0 : (double) totalFailures / completed;
    }
}
