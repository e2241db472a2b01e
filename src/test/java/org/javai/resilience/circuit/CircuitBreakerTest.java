package org.javai.resilience.circuit;

import org.javai.resilience.CircuitOpenException;
import org.javai.resilience.FailureKind;
import org.javai.resilience.RecordingReporter;
import org.javai.resilience.RecordingReporter.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private RecordingReporter reporter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        reporter = new RecordingReporter();
    }

    private CircuitBreaker breaker(CircuitBreakerConfig config) {
        return new CircuitBreaker("api", config, clock, reporter);
    }

    private static void failOnce(CircuitBreaker breaker) {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);
    }

    @Test
    void execute_opensAfterThresholdAndShortCircuits() {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(3, Duration.ofSeconds(60), 1));
        AtomicInteger invocations = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                invocations.incrementAndGet();
                throw new IOException("down");
            })).isInstanceOf(IOException.class);
        }
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);

        assertThatThrownBy(() -> breaker.execute(() -> invocations.incrementAndGet()))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> {
                    CircuitOpenException open = (CircuitOpenException) e;
                    assertThat(open.circuitName()).isEqualTo("api");
                    assertThat(open.state()).isEqualTo(CircuitState.OPEN);
                    assertThat(open.retryAfter()).isEqualTo(Duration.ofSeconds(60));
                });
        assertThat(invocations.get()).isEqualTo(3);
        assertThat(reporter.failures).singleElement()
                .satisfies(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.CIRCUIT_OPEN));
    }

    @Test
    void execute_successResetsConsecutiveFailures() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(3, Duration.ofSeconds(60), 1));

        failOnce(breaker);
        failOnce(breaker);
        breaker.execute(() -> "ok");
        failOnce(breaker);
        failOnce(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().failureCount()).isEqualTo(2);
    }

    @Test
    void execute_afterResetTimeout_trialSuccessCloses() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30), 1));
        failOnce(breaker);

        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(() -> breaker.execute(() -> "early"))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).retryAfter()).isEqualTo(Duration.ofSeconds(1)));

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.<String>execute(() -> "probe")).isEqualTo("probe");

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(reporter.transitions).containsExactly(
                new Transition("api", CircuitState.CLOSED, CircuitState.OPEN),
                new Transition("api", CircuitState.OPEN, CircuitState.HALF_OPEN),
                new Transition("api", CircuitState.HALF_OPEN, CircuitState.CLOSED));
    }

    @Test
    void execute_trialFailure_reopensWithFreshTimestamp() {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(30), 1));
        failOnce(breaker);
        Instant firstOpened = breaker.openedAt();

        clock.advance(Duration.ofSeconds(30));
        failOnce(breaker);

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.openedAt()).isEqualTo(firstOpened.plusSeconds(30));
        assertThatThrownBy(() -> breaker.execute(() -> "still open"))
                .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void execute_successThreshold_needsConsecutiveTrialSuccesses() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(10), 2));
        failOnce(breaker);
        clock.advance(Duration.ofSeconds(10));

        breaker.execute(() -> "first");
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.stats().successCount()).isEqualTo(1);

        breaker.execute(() -> "second");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void execute_slidingWindow_countsOnlyRecentFailures() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .window(FailureWindow.sliding(Duration.ofSeconds(10)))
                .build());

        failOnce(breaker);
        failOnce(breaker);
        clock.advance(Duration.ofSeconds(11));
        failOnce(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().failureCount()).isEqualTo(1);

        breaker.execute(() -> "success does not clear the window");
        failOnce(breaker);
        failOnce(breaker);
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void execute_ignoredExceptions_doNotOpenCircuit() {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .ignore(IllegalArgumentException.class)
                .build());

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalArgumentException("caller error");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().totalFailures()).isZero();
    }

    @Test
    void execute_ignoredExceptionDuringTrial_freesSlot() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .resetTimeout(Duration.ofSeconds(5))
                .ignore(IllegalArgumentException.class)
                .build());
        failOnce(breaker);
        clock.advance(Duration.ofSeconds(5));

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalArgumentException("caller error");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.stats().halfOpenInFlight()).isZero();

        breaker.execute(() -> "trial");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void execute_throwingRecordFailurePredicate_countsAsFailureAndFreesSlot() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .resetTimeout(Duration.ofSeconds(5))
                .recordFailure(failure -> {
                    if (failure instanceof IllegalStateException) {
                        throw new IllegalArgumentException("predicate failed");
                    }
                    return true;
                })
                .build());
        failOnce(breaker);
        clock.advance(Duration.ofSeconds(5));

        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalStateException("trial");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("predicate failed");
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.stats().halfOpenInFlight()).isZero();

        clock.advance(Duration.ofSeconds(5));
        assertThat(breaker.<String>execute(() -> "recovered")).isEqualTo("recovered");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void reset_closesAndClearsCounters() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(1, Duration.ofMinutes(5), 1));
        failOnce(breaker);

        breaker.reset();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().totalFailures()).isZero();
        assertThat(breaker.<String>execute(() -> "ok")).isEqualTo("ok");
    }

    @Test
    void forceOpen_rejectsUntilResetTimeout() {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.defaults());

        breaker.forceOpen();

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.openedAt()).isEqualTo(clock.instant());
        assertThatThrownBy(() -> breaker.execute(() -> "blocked"))
                .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void stats_reflectsCalls() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(2, Duration.ofSeconds(60), 1));

        breaker.execute(() -> "ok");
        failOnce(breaker);
        failOnce(breaker);
        assertThatThrownBy(() -> breaker.execute(() -> "rejected"))
                .isInstanceOf(CircuitOpenException.class);

        CircuitBreakerStats stats = breaker.stats();
        assertThat(stats.name()).isEqualTo("api");
        assertThat(stats.state()).isEqualTo(CircuitState.OPEN);
        assertThat(stats.totalCalls()).isEqualTo(3);
        assertThat(stats.totalSuccesses()).isEqualTo(1);
        assertThat(stats.totalFailures()).isEqualTo(2);
        assertThat(stats.totalRejections()).isEqualTo(1);
        assertThat(stats.timesOpened()).isEqualTo(1);
        assertThat(stats.openedAt()).isEqualTo(clock.instant());
        assertThat(stats.failureRate()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void execute_staleResultAfterOpen_doesNotCloseCircuit() throws Exception {
        CircuitBreaker breaker = breaker(CircuitBreakerConfig.of(1, Duration.ofSeconds(60), 1));

        String result = breaker.execute(() -> {
            breaker.forceOpen();
            return "admitted before the trip";
        });

        assertThat(result).isEqualTo("admitted before the trip");
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void config_rejectsInvalidThreshold() {
        assertThatThrownBy(() -> CircuitBreakerConfig.of(0, Duration.ofSeconds(1), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("failureThreshold must be >= 1, was: 0");
    }

    @Test
    void config_defaults() {
        CircuitBreakerConfig config = CircuitBreakerConfig.defaults();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.resetTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.successThreshold()).isEqualTo(1);
        assertThat(config.halfOpenMaxCalls()).isEqualTo(1);
        assertThat(config.window().isSliding()).isFalse();
    }
}
