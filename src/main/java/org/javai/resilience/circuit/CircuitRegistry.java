package org.javai.resilience.circuit;

import org.javai.resilience.ops.ResilienceReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds one {@link CircuitBreaker} per name.
 *
 * <p>{@code getOrCreate} is atomic: concurrent first calls for the same name all receive the
 * same instance. The first caller's configuration wins; configurations passed by later
 * callers for an existing name are ignored.</p>
 *
 * <p>Breakers created here share the registry's clock and reporter. Most applications use the
 * process-wide {@link #global()} instance; tests create their own.</p>
 */
public final class CircuitRegistry {

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ResilienceReporter reporter;

    public CircuitRegistry() {
        this(ResilienceReporter.noOp());
    }

    public CircuitRegistry(ResilienceReporter reporter) {
        this(Clock.systemUTC(), reporter);
    }

    CircuitRegistry(Clock clock, ResilienceReporter reporter) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * The process-wide registry, created on first use.
     */
    public static CircuitRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Returns the breaker registered under {@code name}, creating it with {@code config}
     * if absent.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, config, clock, reporter));
    }

    /**
     * Returns the breaker registered under {@code name}, creating a consecutive-failure
     * breaker with the given settings if absent.
     */
    public CircuitBreaker getOrCreate(String name, int failureThreshold, Duration resetTimeout, int successThreshold) {
        return getOrCreate(name, CircuitBreakerConfig.of(failureThreshold, resetTimeout, successThreshold));
    }

    /**
     * Returns the breaker registered under {@code name}, creating it with
     * {@link CircuitBreakerConfig#defaults()} if absent.
     */
    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, CircuitBreakerConfig.defaults());
    }

    public Optional<CircuitBreaker> find(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * Registered names, sorted.
     */
    public Set<String> names() {
        return new TreeSet<>(breakers.keySet());
    }

    /**
     * A stats snapshot of every registered breaker, keyed by name. Each snapshot is
     * consistent on its own; the map as a whole is not taken atomically.
     */
    public Map<String, CircuitBreakerStats> stats() {
        return breakers.values().stream()
                .map(CircuitBreaker::stats)
                .collect(Collectors.toMap(CircuitBreakerStats::name, stats -> stats));
    }

    /**
     * Resets every registered breaker to CLOSED. Breakers stay registered.
     */
    public void resetAll() {
        List.copyOf(breakers.values()).forEach(CircuitBreaker::reset);
    }

    public int size() {
        return breakers.size();
    }

    private static final class GlobalHolder {
        static final CircuitRegistry INSTANCE = new CircuitRegistry();
    }
}
