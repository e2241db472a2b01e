package org.javai.resilience;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Outcome#isFail()} first.
 * The cause is the exception captured by the failure, when there is one.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed: " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
