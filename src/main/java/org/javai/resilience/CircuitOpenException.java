package org.javai.resilience;

import org.javai.resilience.circuit.CircuitState;

import java.time.Duration;

/**
 * Thrown when a circuit breaker short-circuits a call. The protected work was not invoked.
 */
public class CircuitOpenException extends ResilienceException {

    private final String circuitName;
    private final CircuitState state;
    private final Duration retryAfter;

    public CircuitOpenException(String circuitName, CircuitState state, Duration retryAfter) {
        super("Circuit '" + circuitName + "' is " + state + ", call rejected");
        this.circuitName = circuitName;
        this.state = state;
        this.retryAfter = retryAfter;
    }

    public String circuitName() {
        return circuitName;
    }

    /**
     * The state that caused the rejection: OPEN, or HALF_OPEN when all trial slots were taken.
     */
    public CircuitState state() {
        return state;
    }

    /**
     * Time remaining before the breaker admits a trial call. Zero when half-open.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CIRCUIT_OPEN;
    }
}
