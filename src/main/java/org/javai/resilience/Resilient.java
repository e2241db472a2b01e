package org.javai.resilience;

import org.javai.resilience.circuit.CircuitRegistry;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.timeout.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Duration;
import java.util.Objects;

/**
 * Wraps service methods in a fixed set of policies, built once and reused for every call.
 *
 * <p>Order, outer to inner: fallback, timeout, retry, circuit breaker, work. Each layer is
 * optional. A failure that gets past the pipeline is logged at the configured level, then
 * either replaced by the fallback value or rethrown. An {@link InterruptedException} is always
 * rethrown. Successful calls log nothing.</p>
 *
 * <pre>{@code
 * Resilient resilient = Resilient.builder()
 *     .operation("recipes.generate")
 *     .retry(3)
 *     .timeout(Duration.ofSeconds(30))
 *     .fallback(List.of())
 *     .build();
 *
 * ThrowingFunction<String, List<Recipe>, Exception> generate = resilient.decorate(service::generate);
 * List<Recipe> recipes = generate.apply(context);
 * }</pre>
 *
 * <p>With a circuit name, the breaker is looked up in the registry on each call, so every
 * wrapper naming the same circuit shares its state.</p>
 */
public final class Resilient {

    private final String operation;
    private final Pipeline pipeline;
    private final boolean hasFallback;
    private final Object fallbackValue;
    private final Level logLevel;
    private final Logger logger;

    private Resilient(Builder builder, Pipeline pipeline) {
        this.operation = builder.operation;
        this.pipeline = pipeline;
        this.hasFallback = builder.hasFallback;
        this.fallbackValue = builder.fallbackValue;
        this.logLevel = builder.logLevel;
        this.logger = builder.logger;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the work through the pipeline.
     *
     * @return the work's result, or the fallback value if one is configured and the call failed
     * @throws Exception the failure, when no fallback is configured
     */
    public <T> T call(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return pipeline.execute(work);
        } catch (Exception e) {
            logger.atLevel(logLevel)
                    .setCause(e)
                    .log("Failure in {}: {}", operation, e.getMessage());
            if (hasFallback && !(e instanceof InterruptedException)) {
                @SuppressWarnings("unchecked")
                T result = (T) fallbackValue;
                return result;
            }
            throw e;
        }
    }

    public <T> ThrowingSupplier<T, Exception> decorate(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(work);
    }

    public <A, R> ThrowingFunction<A, R, Exception> decorate(ThrowingFunction<A, R, ? extends Exception> function) {
        Objects.requireNonNull(function, "function must not be null");
        return argument -> call(() -> function.apply(argument));
    }

    /**
     * The policies this wrapper runs, outermost first. The fallback is applied by the wrapper
     * itself and is not part of the pipeline.
     */
    public Pipeline pipeline() {
        return pipeline;
    }

    public String operation() {
        return operation;
    }

    /**
     * Builder for a {@link Resilient} wrapper. Nothing is enabled by default.
     */
    public static final class Builder {
        private String operation = "operation";
        private int maxAttempts;
        private Duration timeout;
        private boolean hasFallback;
        private Object fallbackValue;
        private String circuit;
        private CircuitRegistry registry;
        private Level logLevel = Level.ERROR;
        private Logger logger = LoggerFactory.getLogger(Resilient.class);

        private Builder() {}

        /**
         * Names the wrapped operation in log messages.
         */
        public Builder operation(String operation) {
            this.operation = Objects.requireNonNull(operation, "operation must not be null");
            return this;
        }

        /**
         * Enables retry with the given total number of attempts, 1s base delay and jitter.
         * Zero disables retry.
         */
        public Builder retry(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        /**
         * Returns {@code value} (which may be null) instead of rethrowing a failure.
         */
        public Builder fallback(Object value) {
            this.fallbackValue = value;
            this.hasFallback = true;
            return this;
        }

        /**
         * Guards the work with the named circuit breaker.
         */
        public Builder circuit(String circuit) {
            this.circuit = Objects.requireNonNull(circuit, "circuit must not be null");
            return this;
        }

        /**
         * The registry to take the circuit from. Defaults to {@link CircuitRegistry#global()}.
         */
        public Builder registry(CircuitRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel must not be null");
            return this;
        }

        /**
         * Sets the logger for testing (package-private).
         */
        Builder logger(Logger logger) {
            this.logger = Objects.requireNonNull(logger, "logger must not be null");
            return this;
        }

        public Resilient build() {
            Pipeline.Builder policies = Pipeline.builder();
            if (timeout != null) {
                policies.add(TimeoutPolicy.of(timeout));
            }
            if (maxAttempts > 0) {
                policies.add(RetryPolicy.builder()
                        .name(operation + ".retry")
                        .maxAttempts(maxAttempts)
                        .baseDelay(Duration.ofSeconds(1))
                        .jitter(true)
                        .build());
            }
            if (circuit != null) {
                CircuitRegistry source = registry != null ? registry : CircuitRegistry.global();
                policies.add(new RegisteredCircuit(circuit, source));
            }
            return new Resilient(this, policies.build());
        }
    }

    /**
     * Looks the breaker up per call rather than at build time.
     */
    private static final class RegisteredCircuit implements Policy {
        private final String circuit;
        private final CircuitRegistry registry;

        RegisteredCircuit(String circuit, CircuitRegistry registry) {
            this.circuit = circuit;
            this.registry = registry;
        }

        @Override
        public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
            return registry.getOrCreate(circuit).execute(work);
        }

        @Override
        public String name() {
            return circuit;
        }
    }
}
