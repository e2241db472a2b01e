package org.javai.resilience.circuit;

import org.javai.resilience.CircuitOpenException;
import org.javai.resilience.Failure;
import org.javai.resilience.Policy;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.ops.ResilienceReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A stateful failure gate in front of one dependency, usable as a {@link Policy}.
 *
 * <h2>State machine</h2>
 * <ul>
 *   <li><b>CLOSED</b> (initial): calls pass through. Failures are counted per the configured
 *       {@link FailureWindow}; reaching {@code failureThreshold} opens the circuit.</li>
 *   <li><b>OPEN</b>: calls fail with {@link CircuitOpenException} without invoking the work.
 *       This path takes the lock once and touches no I/O. Once {@code resetTimeout} has passed
 *       since the circuit opened, the next call moves it to HALF_OPEN and is let through as a
 *       trial.</li>
 *   <li><b>HALF_OPEN</b>: at most {@code halfOpenMaxCalls} trial calls run at once; others are
 *       rejected. {@code successThreshold} consecutive trial successes close the circuit. Any
 *       trial failure reopens it with a fresh open timestamp.</li>
 * </ul>
 *
 * <p>Exceptions rejected by the config's {@code recordFailure} predicate are rethrown but are
 * neutral for the state machine: they neither count as failures nor as successes, and they
 * free their trial slot. If the predicate itself throws, the call is recorded as a failure and
 * the predicate's exception propagates.</p>
 *
 * <h2>Thread safety</h2>
 * <p>All state and counters are guarded by one {@link ReentrantLock}, held only to admit a call
 * and to record its result, never while the work runs. Each transition starts a new epoch;
 * a result is only applied if its call was admitted in the current epoch, so a slow call
 * admitted before the circuit opened cannot close it again later.</p>
 *
 * <p>Time comes from the injected {@link Clock}. Breakers are normally obtained from a
 * {@link CircuitRegistry}, which guarantees one instance per name.</p>
 */
public final class CircuitBreaker implements Policy {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ResilienceReporter reporter;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private long epoch;
    private int consecutiveFailures;
    private final Deque<Instant> failureTimes = new ArrayDeque<>();
    private int successCount;
    private int halfOpenInFlight;
    private Instant openedAt;
    private Instant lastTransitionAt;
    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejections;
    private long timesOpened;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), ResilienceReporter.noOp());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, ResilienceReporter reporter) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.lastTransitionAt = clock.instant();
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        Permit permit = acquirePermit();
        T result;
        try {
            result = work.get();
        } catch (Throwable t) {
            settleFailure(permit, t);
            throw t;
        }
        onSuccess(permit);
        return result;
    }

    private Permit acquirePermit() {
        Transition transition = null;
        CircuitOpenException rejection = null;
        Permit permit = null;

        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN) {
                Duration remaining = remainingOpenTime(now);
                if (remaining.isZero()) {
                    transition = transitionTo(CircuitState.HALF_OPEN, now);
                } else {
                    totalRejections++;
                    rejection = new CircuitOpenException(name, CircuitState.OPEN, remaining);
                }
            }
            if (rejection == null) {
                if (state == CircuitState.HALF_OPEN) {
                    if (halfOpenInFlight >= config.halfOpenMaxCalls()) {
                        totalRejections++;
                        rejection = new CircuitOpenException(name, CircuitState.HALF_OPEN, Duration.ZERO);
                    } else {
                        halfOpenInFlight++;
                        totalCalls++;
                        permit = new Permit(epoch, CircuitState.HALF_OPEN);
                    }
                } else {
                    totalCalls++;
                    permit = new Permit(epoch, CircuitState.CLOSED);
                }
            }
        } finally {
            lock.unlock();
        }

        publish(transition);
        if (rejection != null) {
            reporter.report(Failure.of(name, rejection));
            throw rejection;
        }
        return permit;
    }

    // A recordFailure predicate that throws counts the call as failed, so the permit is always settled.
    private void settleFailure(Permit permit, Throwable failure) {
        boolean recorded = true;
        try {
            recorded = config.recordFailure().test(failure);
        } finally {
            if (recorded) {
                onFailure(permit);
            } else {
                onIgnored(permit);
            }
        }
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        lock.lock();
        try {
            totalSuccesses++;
            if (permit.epoch() != epoch) {
                return;
            }
            if (state == CircuitState.CLOSED) {
                consecutiveFailures = 0;
            } else if (state == CircuitState.HALF_OPEN) {
                halfOpenInFlight--;
                successCount++;
                if (successCount >= config.successThreshold()) {
                    transition = transitionTo(CircuitState.CLOSED, clock.instant());
                }
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private void onFailure(Permit permit) {
        Transition transition = null;
        lock.lock();
        try {
            totalFailures++;
            if (permit.epoch() != epoch) {
                return;
            }
            Instant now = clock.instant();
            if (state == CircuitState.CLOSED) {
                if (countFailure(now) >= config.failureThreshold()) {
                    transition = transitionTo(CircuitState.OPEN, now);
                }
            } else if (state == CircuitState.HALF_OPEN) {
                transition = transitionTo(CircuitState.OPEN, now);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private void onIgnored(Permit permit) {
        lock.lock();
        try {
            if (permit.epoch() == epoch && state == CircuitState.HALF_OPEN) {
                halfOpenInFlight--;
            }
        } finally {
            lock.unlock();
        }
    }

    // Called with lock held. Returns the failure count relevant to the threshold.
    private int countFailure(Instant now) {
        if (!config.window().isSliding()) {
            return ++consecutiveFailures;
        }
        failureTimes.addLast(now);
        evictExpiredFailures(now);
        return failureTimes.size();
    }

    private void evictExpiredFailures(Instant now) {
        Instant horizon = now.minus(config.window().duration());
        while (!failureTimes.isEmpty() && !failureTimes.peekFirst().isAfter(horizon)) {
            failureTimes.removeFirst();
        }
    }

    // Called with lock held.
    private Duration remainingOpenTime(Instant now) {
        Duration elapsed = Duration.between(openedAt, now);
        Duration remaining = config.resetTimeout().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    // Called with lock held.
    private Transition transitionTo(CircuitState target, Instant now) {
        CircuitState from = state;
        state = target;
        epoch++;
        lastTransitionAt = now;
        successCount = 0;
        halfOpenInFlight = 0;
        if (target != CircuitState.HALF_OPEN) {
            consecutiveFailures = 0;
            failureTimes.clear();
        }
        if (target == CircuitState.OPEN) {
            openedAt = now;
            timesOpened++;
        }
        return new Transition(from, target);
    }

    private void publish(Transition transition) {
        if (transition != null && transition.from() != transition.to()) {
            reporter.reportStateTransition(name, transition.from(), transition.to());
        }
    }

    /**
     * The current state. An OPEN circuit whose reset timeout has elapsed still reports OPEN
     * until the next call moves it to HALF_OPEN.
     */
    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * When the circuit last opened, or null if it never has.
     */
    public Instant openedAt() {
        lock.lock();
        try {
            return openedAt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * A consistent snapshot of state and counters.
     */
    public CircuitBreakerStats stats() {
        lock.lock();
        try {
            int failures = config.window().isSliding() ? slidingFailureCount() : consecutiveFailures;
            return new CircuitBreakerStats(name, state, failures, successCount, halfOpenInFlight,
                    openedAt, lastTransitionAt, totalCalls, totalSuccesses, totalFailures,
                    totalRejections, timesOpened);
        } finally {
            lock.unlock();
        }
    }

    private int slidingFailureCount() {
        evictExpiredFailures(clock.instant());
        return failureTimes.size();
    }

    /**
     * Forces the circuit to CLOSED and clears every counter, including lifetime totals.
     * Calls admitted before the reset no longer affect the state when they finish.
     */
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = transitionTo(CircuitState.CLOSED, clock.instant());
            totalCalls = 0;
            totalSuccesses = 0;
            totalFailures = 0;
            totalRejections = 0;
            timesOpened = 0;
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * Trips the circuit to OPEN now, as an operator would when a dependency is known to be down.
     */
    public void forceOpen() {
        Transition transition;
        lock.lock();
        try {
            transition = transitionTo(CircuitState.OPEN, clock.instant());
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    @Override
    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "CircuitBreaker[" + name + ", " + state() + "]";
    }

    private record Permit(long epoch, CircuitState admittedIn) {}

    private record Transition(CircuitState from, CircuitState to) {}
}
