package xyz.firestige.redis.guard.circuit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.CircuitBreakerSnapshot;
import xyz.firestige.redis.guard.api.CircuitState;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.testutil.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DefaultCircuitBreaker 状态机")
class DefaultCircuitBreakerTest {

    private MutableClock clock;
    private List<String> transitions;
    private DefaultCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        transitions = new ArrayList<>();
        GuardMetricsRecorder recorder = new GuardMetricsRecorder() {
            @Override
            public void onStateTransition(String name, CircuitState from, CircuitState to) {
                transitions.add(from + "->" + to);
            }
        };
        breaker = new DefaultCircuitBreaker("llm_api",
                new CircuitBreakerConfig(3, Duration.ofSeconds(30), 2), clock, recorder);
    }

    @Test
    @DisplayName("连续失败达到阈值后打开")
    void opensAfterThresholdFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertThat(breaker.getState().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.canExecute()).isTrue();

        breaker.recordFailure();

        assertThat(breaker.getState().state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.canExecute()).isFalse();
        assertThat(transitions).containsExactly("CLOSED->OPEN");
    }

    @Test
    @DisplayName("中间的一次成功会清零失败计数")
    void successResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        CircuitBreakerSnapshot snapshot = breaker.getState();
        assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(snapshot.failureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("恢复时间未到时保持 OPEN，到达后进入 HALF_OPEN")
    void transitionsToHalfOpenAfterRecoveryTimeout() {
        tripOpen();

        clock.advance(Duration.ofSeconds(29));
        assertThat(breaker.canExecute()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.canExecute()).isTrue();

        CircuitBreakerSnapshot snapshot = breaker.getState();
        assertThat(snapshot.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(snapshot.halfOpenCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("releaseProbe 归还未记录结果的探测名额，CLOSED 下为空操作")
    void releaseProbeFreesUnrecordedSlot() {
        breaker.releaseProbe();
        assertThat(breaker.getState().halfOpenCallCount()).isZero();

        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isFalse();

        breaker.recordSuccess();
        breaker.releaseProbe();
        breaker.releaseProbe();

        // 已成功的探测不归还
        assertThat(breaker.getState().halfOpenCallCount()).isEqualTo(1);
        assertThat(breaker.canExecute()).isTrue();
        breaker.recordSuccess();
        assertThat(breaker.getState().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("HALF_OPEN 最多放行 halfOpenMaxCalls 个探测")
    void halfOpenAdmitsLimitedProbes() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isTrue();
        assertThat(breaker.canExecute()).isFalse();
    }

    @Test
    @DisplayName("HALF_OPEN 连续成功后关闭并清零计数")
    void closesAfterHalfOpenSuccesses() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        breaker.canExecute();
        breaker.recordSuccess();
        assertThat(breaker.getState().state()).isEqualTo(CircuitState.HALF_OPEN);
        breaker.canExecute();
        breaker.recordSuccess();

        CircuitBreakerSnapshot snapshot = breaker.getState();
        assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(snapshot.failureCount()).isZero();
        assertThat(snapshot.successCount()).isZero();
        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    @DisplayName("HALF_OPEN 任意一次失败立即回到 OPEN")
    void reopensOnHalfOpenFailure() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        breaker.canExecute();
        breaker.recordSuccess();
        breaker.canExecute();
        breaker.recordFailure();

        assertThat(breaker.getState().state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.canExecute()).isFalse();
    }

    @Test
    @DisplayName("reset 回到 CLOSED 并清空计数")
    void resetClearsState() {
        tripOpen();

        breaker.reset();

        CircuitBreakerSnapshot snapshot = breaker.getState();
        assertThat(snapshot.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(snapshot.failureCount()).isZero();
        assertThat(snapshot.lastFailureTime()).isNull();
        assertThat(breaker.canExecute()).isTrue();
    }

    @Test
    @DisplayName("并发探测不会超过 halfOpenMaxCalls")
    void concurrentProbesAreBounded() throws Exception {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    if (breaker.canExecute()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(admitted.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void rejectsInvalidConfig() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, Duration.ofSeconds(1), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(1, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertThat(breaker.getState().state()).isEqualTo(CircuitState.OPEN);
    }
}
