package xyz.firestige.redis.guard.backpressure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.BackpressureController;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AdaptiveRateLimiter")
class AdaptiveRateLimiterTest {

    private final BackpressureController controller = mock(BackpressureController.class);
    private final AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(controller, "ai_processor_queue");

    @Test
    @DisplayName("低压力时使用基础速率")
    void baseRateBelowHalfPressure() {
        when(controller.getPressureLevel("ai_processor_queue")).thenReturn(0.3);

        assertThat(limiter.getCurrentRate()).isEqualTo(10.0);
        assertThat(limiter.getDelay()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("压力 0.75 时速率降到一半区间")
    void rateDegradesLinearly() {
        when(controller.getPressureLevel("ai_processor_queue")).thenReturn(0.75);

        assertThat(limiter.getCurrentRate()).isCloseTo(5.5, within(1e-9));
    }

    @Test
    @DisplayName("满载及过载时使用最低速率")
    void minRateAtFullPressure() {
        when(controller.getPressureLevel("ai_processor_queue")).thenReturn(1.0, 3.0);

        assertThat(limiter.getCurrentRate()).isEqualTo(1.0);
        assertThat(limiter.getDelay()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("速率不为正时间隔为 1 秒")
    void nonPositiveRateFallsBackToOneSecond() {
        AdaptiveRateLimiter stopped = new AdaptiveRateLimiter(controller, "q", 0.0, 0.0);
        when(controller.getPressureLevel("q")).thenReturn(0.1);

        assertThat(stopped.getDelay()).isEqualTo(Duration.ofSeconds(1));
    }
}
