package org.javai.resilience;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A failed execution, ready for reporting or inspection.
 *
 * @param kind Why the execution failed
 * @param policy The policy (or circuit) that produced or observed the failure
 * @param message Human-readable description
 * @param exception The underlying exception (may be null)
 * @param occurredAt When the failure happened
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureKind kind,
        String policy,
        String message,
        Throwable exception,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Creates a failure for an exception, classifying it with {@link FailureKind#classify}.
     */
    public static Failure of(String policy, Throwable exception) {
        return of(policy, exception, Instant.now());
    }

    /**
     * Creates a failure for an exception observed at a given instant.
     */
    public static Failure of(String policy, Throwable exception, Instant occurredAt) {
        Objects.requireNonNull(exception, "exception must not be null");
        return new Failure(FailureKind.classify(exception), policy, messageOf(exception),
                exception, occurredAt, null);
    }

    /**
     * Returns a copy of this failure with the given tags.
     */
    public Failure withTags(Map<String, String> tags) {
        return new Failure(kind, policy, message, exception, occurredAt, tags);
    }

    /**
     * Namespaced failure code, e.g. {@code resilience:circuit_open}.
     */
    public String code() {
        return kind.code();
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
