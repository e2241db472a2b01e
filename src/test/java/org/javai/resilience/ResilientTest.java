package org.javai.resilience;

import org.javai.resilience.circuit.CircuitRegistry;
import org.javai.resilience.circuit.CircuitState;
import org.javai.resilience.retry.RetryPolicy;
import org.javai.resilience.timeout.TimeoutPolicy;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResilientTest {

    private final CapturingLogger logger = new CapturingLogger();

    @Test
    void call_success_logsNothing() throws Exception {
        Resilient resilient = Resilient.builder().logger(logger).fallback("unused").build();

        assertThat(resilient.<String>call(() -> "fresh")).isEqualTo("fresh");
        assertThat(logger.events).isEmpty();
    }

    @Test
    void call_failureWithFallback_logsAndReturnsFallback() throws Exception {
        Resilient resilient = Resilient.builder()
                .operation("recipes.generate")
                .fallback(List.of())
                .logger(logger)
                .build();

        List<String> recipes = resilient.call(() -> {
            throw new IOException("model unavailable");
        });

        assertThat(recipes).isEmpty();
        assertThat(logger.events).singleElement().satisfies(event -> {
            assertThat(event.level()).isEqualTo(Level.ERROR);
            assertThat(event.message()).isEqualTo("Failure in recipes.generate: model unavailable");
            assertThat(event.cause()).isInstanceOf(IOException.class);
        });
    }

    @Test
    void call_failureWithoutFallback_rethrowsAtConfiguredLevel() {
        Resilient resilient = Resilient.builder()
                .logLevel(Level.WARN)
                .logger(logger)
                .build();
        IOException failure = new IOException("db locked");

        assertThatThrownBy(() -> resilient.call(() -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(logger.events).extracting(CapturingLogger.Event::level).containsExactly(Level.WARN);
    }

    @Test
    void build_ordersTimeoutRetryCircuit() {
        Resilient resilient = Resilient.builder()
                .operation("weather")
                .timeout(Duration.ofSeconds(5))
                .retry(2)
                .circuit("weather-api")
                .registry(new CircuitRegistry())
                .build();

        List<Policy> policies = resilient.pipeline().policies();

        assertThat(policies).hasSize(3);
        assertThat(policies.get(0)).isInstanceOf(TimeoutPolicy.class);
        assertThat(policies.get(1)).isInstanceOfSatisfying(RetryPolicy.class,
                retry -> assertThat(retry.maxAttempts()).isEqualTo(2));
        assertThat(policies.get(2).name()).isEqualTo("weather-api");
    }

    @Test
    void build_withNothingEnabled_hasEmptyPipeline() {
        assertThat(Resilient.builder().build().pipeline().isEmpty()).isTrue();
    }

    @Test
    void circuit_isSharedThroughRegistry() throws Exception {
        CircuitRegistry registry = new CircuitRegistry();
        registry.getOrCreate("inventory", 1, Duration.ofMinutes(1), 1);
        Resilient first = Resilient.builder().circuit("inventory").registry(registry).logger(logger).build();
        Resilient second = Resilient.builder().circuit("inventory").registry(registry).logger(logger)
                .fallback(-1).build();
        AtomicInteger invoked = new AtomicInteger();

        assertThatThrownBy(() -> first.call(() -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);

        int result = second.call(invoked::incrementAndGet);

        assertThat(result).isEqualTo(-1);
        assertThat(invoked.get()).isZero();
        assertThat(registry.find("inventory").orElseThrow().state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void decorate_function_runsThroughPipeline() throws Exception {
        Resilient resilient = Resilient.builder().fallback(0).logger(logger).build();
        ThrowingFunction<String, Integer, Exception> parse = resilient.decorate(
                (ThrowingFunction<String, Integer, NumberFormatException>) Integer::parseInt);

        assertThat(parse.apply("12")).isEqualTo(12);
        assertThat(parse.apply("twelve")).isZero();
    }

    @Test
    void decorate_supplier_retriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Resilient resilient = Resilient.builder().retry(2).logger(logger).build();
        ThrowingSupplier<String, Exception> flaky = resilient.decorate(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("first call fails");
            }
            return "second call works";
        });

        assertThat(flaky.get()).isEqualTo("second call works");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(logger.events).isEmpty();
    }

    @Test
    void retry_rejectsNegative() {
        assertThatThrownBy(() -> Resilient.builder().retry(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxAttempts must be >= 0, was: -1");
    }
}
