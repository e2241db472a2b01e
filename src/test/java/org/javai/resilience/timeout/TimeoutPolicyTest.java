package org.javai.resilience.timeout;

import org.javai.resilience.FailureKind;
import org.javai.resilience.RecordingReporter;
import org.javai.resilience.TimeoutExceededException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class TimeoutPolicyTest {

    @Test
    void execute_fastWork_returnsResult() throws Exception {
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofSeconds(5));

        assertThat(policy.<String>execute(() -> "quick")).isEqualTo("quick");
    }

    @Test
    void execute_timeoutBeyondNanoRange_waitsForResult() throws Exception {
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofDays(365L * 1000));

        String result = policy.execute(() -> "done");

        assertThat(result).isEqualTo("done");
    }

    @Test
    void execute_slowWork_throwsTimeoutExceeded() {
        RecordingReporter reporter = new RecordingReporter();
        TimeoutPolicy policy = TimeoutPolicy.builder()
                .timeout(Duration.ofMillis(50))
                .reporter(reporter)
                .build();

        assertThatThrownBy(() -> policy.execute(() -> {
            Thread.sleep(5_000);
            return "late";
        }))
                .isInstanceOf(TimeoutExceededException.class)
                .hasMessage("Timeout after 50ms");

        assertThat(reporter.failures).singleElement()
                .satisfies(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT));
    }

    @Test
    void execute_workException_isUnwrapped() {
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofSeconds(5));
        IOException failure = new IOException("refused");

        assertThatThrownBy(() -> policy.execute(() -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void execute_workError_isRethrown() {
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofSeconds(5));

        assertThatThrownBy(() -> policy.execute(() -> {
            throw new AssertionError("broken invariant");
        })).isInstanceOf(AssertionError.class).hasMessage("broken invariant");
    }

    @Test
    void execute_onTimeout_interruptsWorker() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofMillis(50));

        assertThatThrownBy(() -> policy.execute(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        })).isInstanceOf(TimeoutExceededException.class);

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void execute_uninterruptibleWorker_isAbandonedWithoutWaiting() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        TimeoutPolicy policy = TimeoutPolicy.builder()
                .timeout(Duration.ofMillis(50))
                .interruptOnTimeout(false)
                .build();

        long start = System.nanoTime();
        assertThatThrownBy(() -> policy.execute(() -> {
            awaitIgnoringInterrupts(release);
            finished.set(true);
            return "done";
        })).isInstanceOf(TimeoutExceededException.class);
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waitedMillis).isLessThan(2_000);
        assertThat(finished).isFalse();
        release.countDown();
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean done = false;
        while (!done) {
            try {
                done = latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                // keep waiting; this worker does not honour interrupts
            }
        }
    }

    @Test
    void execute_workRunsOnDaemonThread() throws Exception {
        TimeoutPolicy policy = TimeoutPolicy.of(Duration.ofSeconds(5));

        Thread worker = policy.execute(Thread::currentThread);

        assertThat(worker).isNotSameAs(Thread.currentThread());
        assertThat(worker.isDaemon()).isTrue();
        assertThat(worker.getName()).startsWith("resilience-timeout-");
    }

    @Test
    void builder_rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> TimeoutPolicy.of(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ofDefault_usesThirtySeconds() {
        assertThat(TimeoutPolicy.ofDefault().timeout()).isEqualTo(Duration.ofSeconds(30));
    }
}
