package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Exponential backoff schedule.
 *
 * <p>The delay after failed attempt {@code n} (1-based) is
 * {@code min(maxDelay, baseDelay * factor^(n-1))}. With jitter, a random amount in
 * {@code [0, delay)} is added on top; the cap applies before jitter, so a jittered delay
 * may reach just under twice {@code maxDelay}.</p>
 *
 * @param baseDelay delay after the first failed attempt
 * @param factor multiplier applied per further attempt (at least 1.0)
 * @param maxDelay upper bound of the un-jittered delay
 * @param jitter whether to add random jitter
 */
public record Backoff(Duration baseDelay, double factor, Duration maxDelay, boolean jitter) {

    public Backoff {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative");
        }
        if (Double.isNaN(factor) || factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1.0, was: " + factor);
        }
    }

    /**
     * The capped delay after the given failed attempt, without jitter.
     *
     * @param attemptNumber the attempt that failed (1-based)
     */
    public Duration delayFor(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
        // Saturating conversions: durations beyond Long.MAX_VALUE nanos clamp instead of throwing.
        double nanos = TimeUnit.NANOSECONDS.convert(baseDelay) * Math.pow(factor, attemptNumber - 1);
        long capNanos = TimeUnit.NANOSECONDS.convert(maxDelay);
        if (Double.isInfinite(nanos) || nanos >= capNanos) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * The delay after the given failed attempt, with jitter drawn from {@code random} when enabled.
     */
    public Duration delayFor(int attemptNumber, Random random) {
        Duration delay = delayFor(attemptNumber);
        if (!jitter || delay.isZero()) {
            return delay;
        }
        long extra = (long) (random.nextDouble() * TimeUnit.NANOSECONDS.convert(delay));
        return delay.plusNanos(extra);
    }
}
