package org.javai.resilience;

import org.javai.resilience.bulkhead.BulkheadPolicy;
import org.javai.resilience.circuit.CircuitBreaker;
import org.javai.resilience.fallback.FallbackPolicy;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.timeout.TimeoutPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Ready-made pipelines for common kinds of dependency, listed outer to inner.
 *
 * <p>Each factory builds fresh policy instances, so two calls never share a bulkhead. The
 * overloads taking a {@link CircuitBreaker} append it innermost, where it sees every retry
 * attempt as a separate call.</p>
 */
public final class Policies {

    private static final Duration BULKHEAD_MAX_WAIT = Duration.ofSeconds(5);

    private Policies() {}

    /**
     * Third-party HTTP APIs: 30s timeout, 3 attempts (1s, 2s backoff), at most 5 concurrent
     * calls waiting up to 5s for a slot.
     */
    public static Pipeline externalApi() {
        return Pipeline.of(
                TimeoutPolicy.of(Duration.ofSeconds(30)),
                RetryPolicy.builder()
                        .name("externalApi.retry")
                        .maxAttempts(3)
                        .baseDelay(Duration.ofSeconds(1))
                        .backoffFactor(2.0)
                        .build(),
                BulkheadPolicy.blocking(5, BULKHEAD_MAX_WAIT));
    }

    public static Pipeline externalApi(CircuitBreaker breaker) {
        return withBreaker(externalApi(), breaker);
    }

    /**
     * Database access: 10s timeout, 2 attempts (0.5s backoff).
     */
    public static Pipeline database() {
        return Pipeline.of(
                TimeoutPolicy.of(Duration.ofSeconds(10)),
                RetryPolicy.builder()
                        .name("database.retry")
                        .maxAttempts(2)
                        .baseDelay(Duration.ofMillis(500))
                        .backoffFactor(2.0)
                        .build());
    }

    public static Pipeline database(CircuitBreaker breaker) {
        return withBreaker(database(), breaker);
    }

    /**
     * Cache lookups: 1s timeout, any failure reads as a miss (null).
     */
    public static Pipeline cache() {
        return Pipeline.of(
                FallbackPolicy.ofValue(null),
                TimeoutPolicy.of(Duration.ofSeconds(1)));
    }

    public static Pipeline cache(CircuitBreaker breaker) {
        return withBreaker(cache(), breaker);
    }

    /**
     * AI model calls: 60s timeout, 3 attempts (2s, 6s backoff), at most 3 concurrent calls
     * waiting up to 5s for a slot.
     */
    public static Pipeline ai() {
        return Pipeline.of(
                TimeoutPolicy.of(Duration.ofSeconds(60)),
                RetryPolicy.builder()
                        .name("ai.retry")
                        .maxAttempts(3)
                        .baseDelay(Duration.ofSeconds(2))
                        .backoffFactor(3.0)
                        .build(),
                BulkheadPolicy.blocking(3, BULKHEAD_MAX_WAIT));
    }

    public static Pipeline ai(CircuitBreaker breaker) {
        return withBreaker(ai(), breaker);
    }

    private static Pipeline withBreaker(Pipeline pipeline, CircuitBreaker breaker) {
        Objects.requireNonNull(breaker, "breaker must not be null");
        return pipeline.then(breaker);
    }
}
