package org.javai.resilience.bulkhead;

import org.javai.resilience.BulkheadRejectedException;
import org.javai.resilience.Failure;
import org.javai.resilience.Policy;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.ops.ResilienceReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caps the number of concurrent executions sharing this policy instance.
 *
 * <p>Each execution holds one permit of a counting {@link Semaphore} of size
 * {@code maxConcurrent} while the work runs. The permit is released in a {@code finally}
 * block, so normal returns and exceptions alike give the slot back before {@link #execute}
 * returns.</p>
 *
 * <p>When no permit is free:</p>
 * <ul>
 *   <li>{@link QueuePolicy#REJECT}: {@link BulkheadRejectedException} at once.</li>
 *   <li>{@link QueuePolicy#BLOCK}: the caller waits. With a max wait configured it gives up
 *       with {@link BulkheadRejectedException} once that has elapsed; without one it waits
 *       indefinitely.</li>
 * </ul>
 *
 * <p>The semaphore is fair, so blocked callers are served in arrival order. That is the only
 * ordering promise: which of several concurrent callers grabs a free slot first is
 * unspecified.</p>
 *
 * <p>An interrupt while waiting propagates as {@link InterruptedException} without a permit
 * having been taken.</p>
 */
public final class BulkheadPolicy implements Policy {

    private final int maxConcurrent;
    private final QueuePolicy queuePolicy;
    private final Duration maxWait;
    private final Semaphore permits;
    private final ResilienceReporter reporter;

    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();

    private BulkheadPolicy(Builder builder) {
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, was: " + builder.maxConcurrent);
        }
        if (builder.maxWait != null && builder.maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        this.maxConcurrent = builder.maxConcurrent;
        this.queuePolicy = builder.queuePolicy;
        this.maxWait = builder.maxWait;
        this.reporter = builder.reporter;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A rejecting bulkhead with the given capacity.
     */
    public static BulkheadPolicy rejecting(int maxConcurrent) {
        return builder().maxConcurrent(maxConcurrent).queuePolicy(QueuePolicy.REJECT).build();
    }

    /**
     * A blocking bulkhead with the given capacity that waits at most {@code maxWait}.
     */
    public static BulkheadPolicy blocking(int maxConcurrent, Duration maxWait) {
        return builder().maxConcurrent(maxConcurrent).queuePolicy(QueuePolicy.BLOCK).maxWait(maxWait).build();
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        if (!acquire()) {
            rejected.incrementAndGet();
            BulkheadRejectedException rejection = new BulkheadRejectedException(maxConcurrent);
            reporter.report(Failure.of(name(), rejection));
            throw rejection;
        }
        try {
            return work.get();
        } finally {
            permits.release();
            completed.incrementAndGet();
        }
    }

    private boolean acquire() throws InterruptedException {
        if (queuePolicy == QueuePolicy.REJECT) {
            return permits.tryAcquire();
        }
        if (maxWait == null) {
            permits.acquire();
            return true;
        }
        return permits.tryAcquire(TimeUnit.NANOSECONDS.convert(maxWait), TimeUnit.NANOSECONDS);
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public QueuePolicy queuePolicy() {
        return queuePolicy;
    }

    /**
     * The configured max wait, or null when blocking callers wait indefinitely.
     */
    public Duration maxWait() {
        return maxWait;
    }

    /**
     * Number of executions currently holding a slot.
     */
    public int activeCount() {
        return maxConcurrent - permits.availablePermits();
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * Total callers turned away since construction.
     */
    public long rejectedCount() {
        return rejected.get();
    }

    /**
     * Total executions that held a slot and finished, successfully or not.
     */
    public long completedCount() {
        return completed.get();
    }

    @Override
    public String toString() {
        return "BulkheadPolicy[maxConcurrent=" + maxConcurrent + ", queuePolicy=" + queuePolicy
                + (maxWait != null ? ", maxWait=" + maxWait : "") + "]";
    }

    /**
     * Builder for configuring a {@link BulkheadPolicy}.
     *
     * <p>Defaults: 10 concurrent executions, {@link QueuePolicy#BLOCK}, no max wait.</p>
     */
    public static final class Builder {
        private int maxConcurrent = 10;
        private QueuePolicy queuePolicy = QueuePolicy.BLOCK;
        private Duration maxWait;
        private ResilienceReporter reporter = ResilienceReporter.noOp();

        private Builder() {}

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder queuePolicy(QueuePolicy queuePolicy) {
            this.queuePolicy = Objects.requireNonNull(queuePolicy, "queuePolicy must not be null");
            return this;
        }

        /**
         * Bounds how long a {@link QueuePolicy#BLOCK} caller waits for a slot.
         * Ignored for {@link QueuePolicy#REJECT}.
         */
        public Builder maxWait(Duration maxWait) {
            this.maxWait = Objects.requireNonNull(maxWait, "maxWait must not be null");
            return this;
        }

        /**
         * Sets the reporter for rejection events (optional, defaults to no-op).
         */
        public Builder reporter(ResilienceReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public BulkheadPolicy build() {
            return new BulkheadPolicy(this);
        }
    }
}
