package org.javai.resilience;

/**
 * Thrown when every attempt allowed by a retry policy has failed.
 * The cause is the exception raised by the last attempt.
 */
public class RetryExhaustedException extends ResilienceException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Retry exhausted after " + attempts + " attempt(s): " + describe(lastFailure), lastFailure);
        this.attempts = attempts;
    }

    /**
     * Number of attempts made, including the first.
     */
    public int attempts() {
        return attempts;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RETRY_EXHAUSTED;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown";
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    }
}
