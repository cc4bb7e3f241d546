package xyz.firestige.redis.guard.backpressure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.RedisClient;
import xyz.firestige.redis.guard.exception.BackpressureTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RedisBackpressureController")
class RedisBackpressureControllerTest {

    private RedisClient redis;
    private GuardMetricsRecorder recorder;
    private List<Duration> sleeps;
    private RedisBackpressureController controller;

    @BeforeEach
    void setUp() {
        redis = mock(RedisClient.class);
        recorder = mock(GuardMetricsRecorder.class);
        sleeps = new ArrayList<>();
        BackpressureConfig config = BackpressureConfig.builder()
                .threshold("ai_processor_queue", 50)
                .build();
        controller = new RedisBackpressureController(redis, config, sleeps::add, recorder);
    }

    @Test
    @DisplayName("按模式顺序探测队列 Key，返回第一个非零长度")
    void probesKeyPatternsInOrder() {
        when(redis.llen("queue:scraper_queue")).thenReturn(0L);
        when(redis.llen("redis-guard:scraper_queue")).thenReturn(12L);

        assertThat(controller.getQueueLength("scraper_queue")).isEqualTo(12L);

        var order = inOrder(redis);
        order.verify(redis).llen("queue:scraper_queue");
        order.verify(redis).llen("redis-guard:scraper_queue");
    }

    @Test
    @DisplayName("所有候选 Key 都为空时长度为 0")
    void emptyWhenNoKeyHasItems() {
        assertThat(controller.getQueueLength("idle")).isZero();
        verify(redis).llen("idle");
    }

    @Test
    @DisplayName("压力 = 长度 / 阈值，未配置的队列使用默认阈值")
    void pressureIsLengthOverThreshold() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(25L);
        when(redis.llen("queue:other")).thenReturn(25L);

        assertThat(controller.getPressureLevel("ai_processor_queue")).isEqualTo(0.5);
        assertThat(controller.getPressureLevel("other")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("阈值为 0 时压力为 0")
    void zeroThresholdMeansZeroPressure() {
        controller.setThreshold("unbounded", 0);
        when(redis.llen("queue:unbounded")).thenReturn(1000L);

        assertThat(controller.getPressureLevel("unbounded")).isZero();
        assertThat(controller.checkBackpressure("unbounded")).isFalse();
    }

    @Test
    @DisplayName("长度等于阈值不算背压，超过才算")
    void backpressureIsStrictlyAboveThreshold() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(50L, 51L);

        assertThat(controller.checkBackpressure("ai_processor_queue")).isFalse();
        assertThat(controller.checkBackpressure("ai_processor_queue")).isTrue();
    }

    @Test
    @DisplayName("节流阈值是闭区间")
    void throttleIsInclusive() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(35L, 34L);

        assertThat(controller.shouldThrottle("ai_processor_queue")).isTrue();
        assertThat(controller.shouldThrottle("ai_processor_queue")).isFalse();
    }

    @Test
    @DisplayName("推荐延迟：0.5 以下为 base，0.5 到 1.0 线性增加到 max")
    void recommendedDelayInterpolates() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(10L, 25L, 40L, 50L, 100L);
        Duration base = Duration.ofSeconds(1);
        Duration max = Duration.ofSeconds(9);

        assertThat(controller.getRecommendedDelay("ai_processor_queue", base, max)).isEqualTo(base);
        assertThat(controller.getRecommendedDelay("ai_processor_queue", base, max)).isEqualTo(base);
        assertThat(controller.getRecommendedDelay("ai_processor_queue", base, max)).isEqualTo(Duration.ofMillis(5800));
        assertThat(controller.getRecommendedDelay("ai_processor_queue", base, max)).isEqualTo(max);
        assertThat(controller.getRecommendedDelay("ai_processor_queue", base, max)).isEqualTo(max);
    }

    @Test
    @DisplayName("压力低于目标时立即返回，不休眠")
    void waitReturnsImmediatelyWhenBelowTarget() throws Exception {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(10L);

        Duration waited = controller.waitForCapacity("ai_processor_queue");

        assertThat(waited).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("等待直到压力降到目标以下")
    void waitPollsUntilRelieved() throws Exception {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(60L, 45L, 30L);

        Duration waited = controller.waitForCapacity("ai_processor_queue",
                Duration.ofSeconds(2), Duration.ofSeconds(30), 0.8);

        assertThat(waited).isEqualTo(Duration.ofSeconds(4));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(2));
        verify(recorder).onBackpressureWait("ai_processor_queue", Duration.ofSeconds(4), false);
    }

    @Test
    @DisplayName("超过最长等待时间抛出 BackpressureTimeoutException")
    void waitTimesOut() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(100L);

        assertThatThrownBy(() -> controller.waitForCapacity("ai_processor_queue",
                Duration.ofSeconds(5), Duration.ofSeconds(10), 0.8))
                .isInstanceOfSatisfying(BackpressureTimeoutException.class, e -> {
                    assertThat(e.getQueueName()).isEqualTo("ai_processor_queue");
                    assertThat(e.getWaited()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(e.getPressure()).isEqualTo(2.0);
                });
        assertThat(sleeps).hasSize(2);
        verify(recorder).onBackpressureWait("ai_processor_queue", Duration.ofSeconds(10), true);
    }

    @Test
    @DisplayName("等待期间被中断时抛出 InterruptedException")
    void waitIsInterruptible() {
        when(redis.llen("queue:ai_processor_queue")).thenReturn(100L);
        RedisBackpressureController interruptible = new RedisBackpressureController(redis,
                BackpressureConfig.builder().threshold("ai_processor_queue", 50).build(),
                d -> {
                    throw new InterruptedException("cancelled");
                }, null);

        assertThatThrownBy(() -> interruptible.waitForCapacity("ai_processor_queue"))
                .isInstanceOf(InterruptedException.class);
    }

    @Test
    @DisplayName("getAllPressures 覆盖所有已配置队列，不含 default")
    void allPressuresExcludeDefault() {
        controller.setThreshold("scraper_queue", 100);
        when(redis.llen("queue:scraper_queue")).thenReturn(50L);
        when(redis.llen("queue:ai_processor_queue")).thenReturn(50L);

        assertThat(controller.getAllPressures())
                .containsOnlyKeys("ai_processor_queue", "scraper_queue")
                .containsEntry("scraper_queue", 0.5)
                .containsEntry("ai_processor_queue", 1.0);
    }
}
