package org.javai.resilience;

/**
 * Base type for failures raised by a policy itself, as opposed to failures of the work it runs.
 *
 * <p>Unchecked so that it passes through caller code and outer policies without ceremony.
 * Outer policies decide for themselves whether to handle it: a {@link CircuitOpenException}
 * reaching a retry policy with the default predicate, for example, is not retried.</p>
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The kind of failure this exception represents.
     */
    public abstract FailureKind kind();
}
