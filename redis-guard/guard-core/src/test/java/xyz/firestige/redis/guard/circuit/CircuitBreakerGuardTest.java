package xyz.firestige.redis.guard.circuit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.CircuitState;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.exception.CircuitOpenException;
import xyz.firestige.redis.guard.testutil.MutableClock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("CircuitBreakerGuard 调用包装")
class CircuitBreakerGuardTest {

    private CircuitBreakerRegistry registry;
    private GuardMetricsRecorder recorder;
    private CircuitBreakerGuard guard;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        recorder = mock(GuardMetricsRecorder.class);
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), clock, recorder);
        registry.register("payments", new CircuitBreakerConfig(2, Duration.ofSeconds(60), 1));
        registry.register("inventory", new CircuitBreakerConfig(1, Duration.ofSeconds(30), 3));
        guard = new CircuitBreakerGuard(registry, List.of(IOException.class), recorder);
    }

    @Test
    @DisplayName("成功调用返回结果并保持 CLOSED")
    void returnsResultOnSuccess() throws Exception {
        String result = guard.execute("payments", () -> "ok");

        assertThat(result).isEqualTo("ok");
        assertThat(registry.find("payments").orElseThrow().getState().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("被跟踪的异常计入失败并原样抛出")
    void trackedFailureIsRecordedAndRethrown() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute("payments", () -> {
                throw new IOException("timeout");
            })).isInstanceOf(IOException.class).hasMessage("timeout");
        }

        assertThat(registry.getOpenCircuits()).containsExactly("payments");
    }

    @Test
    @DisplayName("未跟踪的异常透传且不影响熔断状态")
    void untrackedFailurePassesThrough() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> guard.execute("payments", () -> {
                throw new IllegalStateException("bad input");
            })).isInstanceOf(IllegalStateException.class);
        }

        assertThat(registry.find("payments").orElseThrow().getState().failureCount()).isZero();
    }

    @Test
    @DisplayName("熔断打开时不执行调用，抛出 CircuitOpenException")
    void rejectsWhenOpen() {
        tripOpen();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> guard.execute("payments", calls::incrementAndGet))
                .isInstanceOfSatisfying(CircuitOpenException.class, e -> {
                    assertThat(e.getBreakerName()).isEqualTo("payments");
                    assertThat(e.getState()).isEqualTo(CircuitState.OPEN);
                    assertThat(e.getRecoveryTimeout()).isEqualTo(Duration.ofSeconds(60));
                });
        assertThat(calls).hasValue(0);
        verify(recorder).onCallRejected("payments");
    }

    @Test
    @DisplayName("熔断打开且有降级时返回降级结果")
    void usesFallbackWhenOpen() throws Exception {
        tripOpen();

        String result = guard.execute("payments", () -> "live", () -> "cached");

        assertThat(result).isEqualTo("cached");
    }

    @Test
    @DisplayName("未注册的熔断器名称：不加保护直接执行")
    void unknownBreakerExecutesUnprotected() throws Exception {
        assertThat(guard.execute("unknown", () -> 42)).isEqualTo(42);
        assertThatThrownBy(() -> guard.execute("unknown", () -> {
            throw new UncheckedIOException(new IOException("x"));
        })).isInstanceOf(UncheckedIOException.class);
        assertThat(registry.find("unknown")).isEmpty();
    }

    @Test
    @DisplayName("HALF_OPEN 探测抛出未跟踪异常：归还名额，后续探测成功后恢复 CLOSED")
    void untrackedHalfOpenFailureReleasesSlot() throws Exception {
        // Given: inventory 已打开，恢复超时已过
        openInventoryAndWaitForRecovery();

        // When: 第一个探测抛出未跟踪异常
        assertThatThrownBy(() -> guard.execute("inventory", () -> {
            throw new IllegalArgumentException("bad request");
        })).isInstanceOf(IllegalArgumentException.class);

        // Then: 名额已归还，三个成功探测即可关闭
        assertThat(registry.find("inventory").orElseThrow().getState().halfOpenCallCount()).isZero();
        for (int i = 0; i < 3; i++) {
            assertThat(guard.execute("inventory", () -> "ok")).isEqualTo("ok");
        }
        assertThat(registry.find("inventory").orElseThrow().getState().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("HALF_OPEN 探测抛出 Error：归还名额并原样抛出")
    void errorDuringHalfOpenCallReleasesSlot() throws Exception {
        openInventoryAndWaitForRecovery();

        assertThatThrownBy(() -> guard.execute("inventory", () -> {
            throw new AssertionError("handler bug");
        })).isInstanceOf(AssertionError.class).hasMessage("handler bug");

        for (int i = 0; i < 3; i++) {
            guard.execute("inventory", () -> "ok");
        }
        assertThat(registry.find("inventory").orElseThrow().getState().state()).isEqualTo(CircuitState.CLOSED);
    }

    private void openInventoryAndWaitForRecovery() {
        assertThatThrownBy(() -> guard.execute("inventory", () -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);
        assertThat(registry.getOpenCircuits()).containsExactly("inventory");
        clock.advance(Duration.ofSeconds(31));
    }

    private void tripOpen() {
        for (int i = 0; i < 2; i++) {
            try {
                guard.execute("payments", () -> {
                    throw new IOException("down");
                });
            } catch (Exception ignored) {
                // expected
            }
        }
        assertThat(registry.getOpenCircuits()).containsExactly("payments");
    }
}
