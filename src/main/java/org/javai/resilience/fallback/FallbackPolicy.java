package org.javai.resilience.fallback;

import org.javai.resilience.Failure;
import org.javai.resilience.Policy;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.ops.ResilienceReporter;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Substitutes a default result when the work fails.
 *
 * <p>If the work throws an exception accepted by {@code appliesTo} (every exception, unless
 * narrowed), the policy returns the fallback function's result for that exception, or the
 * fallback value. Other exceptions, and {@link Error}s, propagate. It never retries. An
 * exception thrown by the fallback function itself propagates.</p>
 *
 * <p>An {@link InterruptedException} is never replaced: it is rethrown before {@code appliesTo}
 * is consulted, so a cancelled caller still sees the interrupt.</p>
 *
 * <p>Typically placed outermost, or directly around one unreliable call, where it ends error
 * propagation for that branch:</p>
 * <pre>{@code
 * Policy policy = FallbackPolicy.ofValue(List.of())
 *     .then(TimeoutPolicy.of(Duration.ofSeconds(1)));
 * List<Suggestion> suggestions = policy.execute(() -> ai.suggest(context));
 * }</pre>
 *
 * <p>{@link Policy#execute} is generic in its result type while a fallback is fixed at
 * construction, so the fallback's type is not checked against the call site. The caller must
 * pair a fallback with work of a compatible result type; a mismatch surfaces as a
 * {@link ClassCastException} where the result is used.</p>
 */
public final class FallbackPolicy implements Policy {

    private final Function<? super Exception, ?> fallback;
    private final Predicate<? super Exception> appliesTo;
    private final ResilienceReporter reporter;

    private FallbackPolicy(Function<? super Exception, ?> fallback, Predicate<? super Exception> appliesTo,
                           ResilienceReporter reporter) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.appliesTo = Objects.requireNonNull(appliesTo, "appliesTo must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * A fallback returning a fixed value (which may be null) for every failure.
     */
    public static FallbackPolicy ofValue(Object value) {
        return builder().value(value).build();
    }

    /**
     * A fallback computing its result from the failure.
     */
    public static FallbackPolicy of(Function<? super Exception, ?> fallbackFunction) {
        return builder().function(fallbackFunction).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        ThrowingSupplier<T, Exception> task = work::get;
        try {
            return task.get();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            if (!appliesTo.test(e)) {
                throw e;
            }
            reporter.reportFallback(Failure.of(name(), e));
            @SuppressWarnings("unchecked")
            T result = (T) fallback.apply(e);
            return result;
        }
    }

    /**
     * Builder for configuring a {@link FallbackPolicy}.
     *
     * <p>Exactly one of {@link #value} or {@link #function} must be set. When both are set the
     * function wins.</p>
     */
    public static final class Builder {
        private Function<? super Exception, ?> function;
        private boolean hasValue;
        private Object value;
        private Predicate<? super Exception> appliesTo = e -> true;
        private ResilienceReporter reporter = ResilienceReporter.noOp();

        private Builder() {}

        public Builder value(Object value) {
            this.value = value;
            this.hasValue = true;
            return this;
        }

        public Builder function(Function<? super Exception, ?> function) {
            this.function = Objects.requireNonNull(function, "function must not be null");
            return this;
        }

        /**
         * Restricts the fallback to failures matching the predicate.
         */
        public Builder appliesTo(Predicate<? super Exception> appliesTo) {
            this.appliesTo = Objects.requireNonNull(appliesTo, "appliesTo must not be null");
            return this;
        }

        /**
         * Restricts the fallback to failures of the given type.
         */
        public Builder appliesTo(Class<? extends Exception> type) {
            Objects.requireNonNull(type, "type must not be null");
            this.appliesTo = type::isInstance;
            return this;
        }

        /**
         * Sets the reporter for fallback events (optional, defaults to no-op).
         */
        public Builder reporter(ResilienceReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Builds the FallbackPolicy.
         *
         * @throws IllegalStateException if neither a value nor a function was set
         */
        public FallbackPolicy build() {
            if (function != null) {
                return new FallbackPolicy(function, appliesTo, reporter);
            }
            if (!hasValue) {
                throw new IllegalStateException("either a fallback value or a fallback function must be set");
            }
            Object constant = value;
            return new FallbackPolicy(e -> constant, appliesTo, reporter);
        }
    }
}
