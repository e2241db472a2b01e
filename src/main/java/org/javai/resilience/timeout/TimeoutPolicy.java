package org.javai.resilience.timeout;

import org.javai.resilience.Failure;
import org.javai.resilience.Policy;
import org.javai.resilience.ThrowingSupplier;
import org.javai.resilience.TimeoutExceededException;
import org.javai.resilience.ops.ResilienceReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the wall-clock time a caller waits for work to finish.
 *
 * <p>The work runs on a worker thread while the caller waits. If the deadline passes first,
 * the caller gets a {@link TimeoutExceededException} straight away; it does not wait for the
 * worker.</p>
 *
 * <h2>Abandoned workers</h2>
 * <p>A timeout stops the <em>waiting</em>, not the <em>work</em>. On expiry the worker's task is
 * cancelled with an interrupt (unless {@code interruptOnTimeout} is off). Work that reacts to
 * interruption (blocking queue operations, {@link Thread#sleep}, interruptible channels) stops
 * early. Work that ignores it, such as a socket read without its own timeout, keeps running in
 * the background until it completes, and keeps holding whatever resources it holds. Callers
 * that need the work itself to stop must give it its own deadline or check
 * {@link Thread#isInterrupted()}.</p>
 *
 * <p>Because the work runs on another thread, thread-local state of the caller (transaction
 * context, MDC) is not visible to it.</p>
 *
 * <p>Exceptions thrown by the work are rethrown unchanged. If the caller is interrupted while
 * waiting, the worker is cancelled and the {@link InterruptedException} propagates.</p>
 */
public final class TimeoutPolicy implements Policy {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration timeout;
    private final ExecutorService executor;
    private final boolean interruptOnTimeout;
    private final ResilienceReporter reporter;

    private TimeoutPolicy(Duration timeout, ExecutorService executor, boolean interruptOnTimeout,
                          ResilienceReporter reporter) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, was: " + timeout);
        }
        this.timeout = timeout;
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.interruptOnTimeout = interruptOnTimeout;
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * A policy with the given timeout, running work on the shared executor.
     */
    public static TimeoutPolicy of(Duration timeout) {
        return builder().timeout(timeout).build();
    }

    /**
     * A policy with the default 30 second timeout.
     */
    public static TimeoutPolicy ofDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The executor shared by every timeout policy that was not given its own.
     * Created on first use; its threads are daemons so it never keeps the JVM alive.
     */
    public static ExecutorService sharedExecutor() {
        return SharedExecutorHolder.INSTANCE;
    }

    @Override
    public <T> T execute(ThrowingSupplier<T, ? extends Exception> work) throws Exception {
        Objects.requireNonNull(work, "work must not be null");
        Callable<T> task = work::get;
        Future<T> future = executor.submit(task);

        try {
            return future.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(interruptOnTimeout);
            TimeoutExceededException exceeded = new TimeoutExceededException(timeout);
            reporter.report(Failure.of(name(), exceeded));
            throw exceeded;
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean interruptOnTimeout() {
        return interruptOnTimeout;
    }

    @Override
    public String toString() {
        return "TimeoutPolicy[timeout=" + timeout + "]";
    }

    /**
     * Builder for configuring a {@link TimeoutPolicy}.
     */
    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private ExecutorService executor;
        private boolean interruptOnTimeout = true;
        private ResilienceReporter reporter = ResilienceReporter.noOp();

        private Builder() {}

        /**
         * Sets the deadline (must be positive). Defaults to 30 seconds.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        /**
         * Runs work on the given executor instead of the shared one.
         * The policy never shuts the executor down.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        /**
         * Whether to interrupt the worker when the deadline passes. Defaults to true.
         */
        public Builder interruptOnTimeout(boolean interruptOnTimeout) {
            this.interruptOnTimeout = interruptOnTimeout;
            return this;
        }

        /**
         * Sets the reporter for timeout events (optional, defaults to no-op).
         */
        public Builder reporter(ResilienceReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public TimeoutPolicy build() {
            return new TimeoutPolicy(timeout, executor != null ? executor : sharedExecutor(),
                    interruptOnTimeout, reporter);
        }
    }

    private static final class SharedExecutorHolder {
        static final ExecutorService INSTANCE = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "resilience-timeout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
