package org.javai.resilience;

import java.util.Objects;

/**
 * Classifies why an execution failed.
 */
public enum FailureKind {

    /**
     * Every attempt of a retry policy failed.
     */
    RETRY_EXHAUSTED("retry_exhausted"),

    /**
     * The work did not finish before its deadline.
     */
    TIMEOUT("timeout"),

    /**
     * A bulkhead had no free slot.
     */
    BULKHEAD_REJECTED("bulkhead_rejected"),

    /**
     * A circuit breaker refused the call without invoking the work.
     */
    CIRCUIT_OPEN("circuit_open"),

    /**
     * The work itself failed and no policy handled it.
     */
    OPERATION_FAILED("operation_failed");

    private static final String NAMESPACE = "resilience";

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    /**
     * Namespaced code, e.g. {@code resilience:timeout}.
     */
    public String code() {
        return NAMESPACE + ":" + code;
    }

    /**
     * Returns the kind for an exception: the policy's kind for a {@link ResilienceException},
     * {@link #OPERATION_FAILED} for anything else.
     */
    public static FailureKind classify(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable must not be null");
        if (throwable instanceof ResilienceException) {
            return ((ResilienceException) throwable).kind();
        }
        return OPERATION_FAILED;
    }
}
