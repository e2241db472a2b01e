package org.javai.resilience;

import java.util.Objects;

/**
 * A resilience strategy that runs a unit of work under some constraint.
 *
 * <p>Every policy satisfies the same contract: {@link #execute} either returns the work's
 * result or throws. What it throws is one of the {@link ResilienceException} subtypes when the
 * policy itself gave up ({@link RetryExhaustedException}, {@link TimeoutExceededException},
 * {@link BulkheadRejectedException}, {@link CircuitOpenException}); any other exception is the
 * work's own, passed through unchanged.</p>
 *
 * <p>Policies compose. {@code outer.then(inner)} yields a {@link Pipeline} that runs
 * {@code outer}'s logic around {@code inner}'s logic around the work. Order matters and is
 * entirely up to the caller:</p>
 * <pre>{@code
 * Policy policy = FallbackPolicy.ofValue(List.of())
 *     .then(RetryPolicy.builder().maxAttempts(3).build())
 *     .then(TimeoutPolicy.of(Duration.ofSeconds(5)));
 *
 * List<Recipe> recipes = policy.execute(() -> api.fetchRecipes());
 * }</pre>
 *
 * <p>Policies are built once and reused across many executions and threads.</p>
 */
public interface Policy {

    /**
     * Runs the work under this policy.
     *
     * @param work the work to execute
     * @param <T> the result type
     * @return the work's result, or a substitute chosen by the policy
     * @throws ResilienceException when the policy refuses or gives up
     * @throws Exception any exception raised by the work and not handled by the policy
     */
    <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception;

    /**
     * Short name used in pipeline descriptions and reporter events.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Composes this policy (outer) with another policy (inner).
     *
     * @param inner the policy to run inside this one
     * @return a pipeline running {@code this} around {@code inner}
     */
    default Pipeline then(Policy inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return Pipeline.compose(this, inner);
    }

    /**
     * Runs the work and captures the result as an {@link Outcome} instead of throwing.
     *
     * <p>Any {@link Exception} becomes {@link Outcome.Fail}; {@link Error}s still propagate.
     * If the calling thread is interrupted, the interrupt flag is preserved.</p>
     *
     * @param work the work to execute
     * @param <T> the result type
     * @return Ok with the result, or Fail with a classified failure
     */
    default <T> Outcome<T> attempt(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return Outcome.ok(execute(work));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(Failure.of(name(), e));
        } catch (Exception e) {
            return Outcome.fail(Failure.of(name(), e));
        }
    }
}
