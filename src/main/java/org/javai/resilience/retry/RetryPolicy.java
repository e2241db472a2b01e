package org.javai.resilience.retry;

import org.javai.resilience.BulkheadRejectedException;
import org.javai.resilience.CircuitOpenException;
import org.javai.resilience.Failure;
import org.javai.resilience.Policy;
import org.javai.resilience.RetryExhaustedException;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.ops.ResilienceReporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Re-invokes failed work with exponential backoff.
 *
 * <p>Each failed attempt is checked against the retry predicate. A failure the predicate
 * rejects propagates unchanged at once. A retryable failure is followed by a sleep (see
 * {@link Backoff}) and another attempt, until {@code maxAttempts} attempts have failed; the
 * policy then throws {@link RetryExhaustedException} with the last failure as its cause.</p>
 *
 * <p>The default predicate retries every exception except {@link CircuitOpenException} and
 * {@link BulkheadRejectedException}. Those mean "back off now"; retrying them blindly turns a
 * tripped breaker into a retry storm. Placing this policy outside a circuit breaker with a
 * predicate that admits {@code CircuitOpenException} is allowed, but every retry will be
 * rejected by the open breaker until its reset timeout elapses.</p>
 *
 * <p>{@link InterruptedException} and {@link Error} are never retried. If the thread is
 * interrupted during a backoff sleep, no further attempt is made and the
 * {@code InterruptedException} propagates.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryPolicy retry = RetryPolicy.builder()
 *     .maxAttempts(3)
 *     .baseDelay(Duration.ofMillis(200))
 *     .backoffFactor(2.0)
 *     .maxDelay(Duration.ofSeconds(5))
 *     .retryOn(IOException.class)
 *     .build();
 * }</pre>
 *
 * <p>The attempt counter is local to each {@link #execute} call, so one instance can be shared
 * by any number of threads.</p>
 */
public final class RetryPolicy implements Policy {

    /**
     * Retries everything except the fast-fail signals of other policies.
     */
    public static final Predicate<Throwable> DEFAULT_RETRY_PREDICATE =
            failure -> !(failure instanceof CircuitOpenException)
                    && !(failure instanceof BulkheadRejectedException);

    private final String name;
    private final int maxAttempts;
    private final Backoff backoff;
    private final Long seed;
    private final Predicate<Throwable> retryOn;
    private final ResilienceReporter reporter;
    private final Sleeper sleeper;

    private RetryPolicy(Builder builder) {
        this.name = builder.name;
        this.maxAttempts = builder.maxAttempts;
        this.backoff = new Backoff(builder.baseDelay, builder.backoffFactor, builder.maxDelay, builder.jitter);
        this.seed = builder.seed;
        this.retryOn = builder.retryOn;
        this.reporter = builder.reporter;
        this.sleeper = builder.sleeper;
    }

    /**
     * Creates a builder for configuring a RetryPolicy.
     *
     * <p>Defaults: 3 attempts, 1s base delay, factor 2.0, 60s max delay, jitter on.</p>
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A policy with the given number of attempts and all other settings at their defaults.
     */
    public static RetryPolicy of(int maxAttempts) {
        return builder().maxAttempts(maxAttempts).build();
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        Random random = seed != null ? new Random(seed) : ThreadLocalRandom.current();

        int attemptNumber = 1;
        while (true) {
            try {
                return work.get();
            } catch (Exception e) {
                RetryDecision decision = decide(attemptNumber, e, random);

                if (decision instanceof RetryDecision.GiveUp) {
                    if (!((RetryDecision.GiveUp) decision).exhausted()) {
                        throw e;
                    }
                    reporter.reportRetryExhausted(Failure.of(name, e), attemptNumber);
                    throw new RetryExhaustedException(attemptNumber, e);
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                reporter.reportRetryAttempt(Failure.of(name, e), attemptNumber, delay);
                sleep(delay);
                attemptNumber++;
            }
        }
    }

    /**
     * Decides what to do after a failed attempt.
     *
     * @param attemptNumber the attempt that failed (1-based)
     * @param failure what it failed with
     * @param random source of jitter
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(int attemptNumber, Exception failure, Random random) {
        if (failure instanceof InterruptedException || !retryOn.test(failure)) {
            return RetryDecision.GiveUp.notRetryable(failure);
        }
        if (attemptNumber >= maxAttempts) {
            return RetryDecision.GiveUp.exhaustedAfter(attemptNumber);
        }
        return RetryDecision.Retry.after(backoff.delayFor(attemptNumber, random));
    }

    private void sleep(Duration delay) throws InterruptedException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        sleeper.sleep(delay);
    }

    @Override
    public String name() {
        return name;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Backoff backoff() {
        return backoff;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", backoff=" + backoff + "]";
    }

    /**
     * Builder for configuring a {@link RetryPolicy}.
     */
    public static final class Builder {
        private String name = "RetryPolicy";
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        private boolean jitter = true;
        private Long seed;
        private Predicate<Throwable> retryOn = DEFAULT_RETRY_PREDICATE;
        private ResilienceReporter reporter = ResilienceReporter.noOp();
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;

        private Builder() {}

        /**
         * Sets the name used in reporter events (optional).
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the total number of attempts, including the first (must be >= 1).
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay after the first failed attempt.
         */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            return this;
        }

        /**
         * Sets the multiplier applied to the delay for each further attempt (must be >= 1.0).
         */
        public Builder backoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        /**
         * Sets the cap on the un-jittered delay.
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            return this;
        }

        /**
         * Enables or disables jitter.
         */
        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Fixes the jitter seed. Every execution then draws the same jitter sequence.
         */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Sets the predicate deciding which failures are retried.
         */
        public Builder retryOn(Predicate<Throwable> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn must not be null");
            return this;
        }

        /**
         * Retries only failures that are instances of one of the given types.
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            Objects.requireNonNull(types, "types must not be null");
            List<Class<? extends Throwable>> retryable = List.of(types);
            this.retryOn = failure -> retryable.stream().anyMatch(type -> type.isInstance(failure));
            return this;
        }

        /**
         * Retries every exception, including {@link CircuitOpenException} and
         * {@link BulkheadRejectedException}.
         */
        public Builder retryOnAll() {
            this.retryOn = failure -> true;
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(ResilienceReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Builds the RetryPolicy.
         *
         * @return a configured RetryPolicy
         * @throws IllegalArgumentException if the backoff settings are invalid
         */
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        Sleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);

        void sleep(Duration delay) throws InterruptedException;
    }
}
