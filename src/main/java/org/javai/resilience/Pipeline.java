package org.javai.resilience;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered composition of policies, itself a {@link Policy}.
 *
 * <p>The first policy is outermost: it sees the call first and its outcome last. Nested
 * pipelines are flattened when a pipeline is built, so {@code compose(compose(a, b), c)} and
 * {@code compose(a, compose(b, c))} hold the same list {@code [a, b, c]} and behave
 * identically.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Pipeline pipeline = Pipeline.builder()
 *     .add(FallbackPolicy.ofValue(0))
 *     .add(RetryPolicy.builder().maxAttempts(3).build())
 *     .add(registry.getOrCreate("db"))
 *     .build();
 *
 * int count = pipeline.execute(() -> dao.count());
 * }</pre>
 *
 * <p>A pipeline holds no state of its own and its order never changes after construction.
 * An empty pipeline runs the work directly.</p>
 */
public final class Pipeline implements Policy {

    private static final Pipeline EMPTY = new Pipeline(List.of());

    private final List<Policy> policies;

    private Pipeline(List<Policy> policies) {
        this.policies = List.copyOf(policies);
    }

    /**
     * Creates a pipeline from policies listed outer to inner.
     *
     * @param policies the policies, outermost first
     * @return a pipeline
     */
    public static Pipeline of(Policy... policies) {
        Objects.requireNonNull(policies, "policies must not be null");
        return of(Arrays.asList(policies));
    }

    /**
     * Creates a pipeline from a collection of policies listed outer to inner.
     *
     * @param policies the policies, outermost first
     * @return a pipeline
     */
    public static Pipeline of(Collection<? extends Policy> policies) {
        Objects.requireNonNull(policies, "policies must not be null");
        List<Policy> flat = new ArrayList<>();
        for (Policy policy : policies) {
            flattenInto(flat, policy);
        }
        return flat.isEmpty() ? EMPTY : new Pipeline(flat);
    }

    /**
     * Composes two policies, {@code outer} around {@code inner}.
     */
    public static Pipeline compose(Policy outer, Policy inner) {
        Objects.requireNonNull(outer, "outer must not be null");
        Objects.requireNonNull(inner, "inner must not be null");
        return of(outer, inner);
    }

    /**
     * Returns a pipeline with no policies.
     */
    public static Pipeline empty() {
        return EMPTY;
    }

    /**
     * Creates a builder that appends policies from outermost to innermost.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    private static void flattenInto(List<Policy> target, Policy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        if (policy instanceof Pipeline) {
            target.addAll(((Pipeline) policy).policies);
        } else {
            target.add(policy);
        }
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        ThrowingSupplier<T, ? extends Exception> chain = work;
        for (int i = policies.size() - 1; i >= 0; i--) {
            chain = wrap(policies.get(i), chain);
        }
        return chain.get();
    }

    private static <T> ThrowingSupplier<T, Exception> wrap(Policy policy, ThrowingSupplier<T, ? extends Exception> inner) {
        return () -> policy.execute(inner);
    }

    /**
     * Returns the policies of this pipeline, outermost first.
     */
    public List<Policy> policies() {
        return policies;
    }

    public int size() {
        return policies.size();
    }

    public boolean isEmpty() {
        return policies.isEmpty();
    }

    @Override
    public String name() {
        return "Pipeline";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pipeline)) {
            return false;
        }
        return policies.equals(((Pipeline) o).policies);
    }

    @Override
    public int hashCode() {
        return policies.hashCode();
    }

    @Override
    public String toString() {
        return policies.stream()
                .map(Policy::name)
                .collect(Collectors.joining(", ", "Pipeline[", "]"));
    }

    /**
     * Builder for a {@link Pipeline}.
     */
    public static final class Builder {
        private final List<Policy> policies = new ArrayList<>();

        private Builder() {}

        /**
         * Appends a policy inside the ones already added.
         *
         * @param policy the policy to add
         * @return this builder
         */
        public Builder add(Policy policy) {
            flattenInto(policies, policy);
            return this;
        }

        /**
         * Conditionally appends a policy.
         *
         * @param condition if true, the policy is added
         * @param policy the policy to add
         * @return this builder
         */
        public Builder addIf(boolean condition, Policy policy) {
            if (condition) {
                add(policy);
            }
            return this;
        }

        public Pipeline build() {
            return policies.isEmpty() ? EMPTY : new Pipeline(policies);
        }
    }
}
