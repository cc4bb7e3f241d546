package xyz.firestige.redis.guard.backpressure;

import xyz.firestige.redis.guard.api.BackpressureController;

import java.time.Duration;
import java.util.Objects;

/**
 * 随下游压力自适应的速率
 *
 * <p>压力低于 0.5 时为 baseRate；0.5 到 1.0 之间线性降到 minRate；超过 1.0 保持 minRate。
 */
public class AdaptiveRateLimiter {

    public static final double DEFAULT_BASE_RATE = 10.0;
    public static final double DEFAULT_MIN_RATE = 1.0;

    private final BackpressureController controller;
    private final String queueName;
    private final double baseRate;
    private final double minRate;

    public AdaptiveRateLimiter(BackpressureController controller, String queueName) {
        this(controller, queueName, DEFAULT_BASE_RATE, DEFAULT_MIN_RATE);
    }

    public AdaptiveRateLimiter(BackpressureController controller, String queueName, double baseRate, double minRate) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        if (minRate > baseRate) {
            throw new IllegalArgumentException("minRate " + minRate + " exceeds baseRate " + baseRate);
        }
        this.baseRate = baseRate;
        this.minRate = minRate;
    }

    /**
     * @return 当前允许的速率（次/秒）
     */
    public double getCurrentRate() {
        double pressure = controller.getPressureLevel(queueName);
        if (pressure < 0.5) {
            return baseRate;
        }
        double factor = 1.0 - Math.min(1.0, (pressure - 0.5) / 0.5);
        return minRate + (baseRate - minRate) * factor;
    }

    /**
     * @return 两次请求之间的间隔，速率不为正时为 1 秒
     */
    public Duration getDelay() {
        double rate = getCurrentRate();
        if (rate <= 0) {
            return Duration.ofSeconds(1);
        }
        return Duration.ofNanos(Math.round(1_000_000_000L / rate));
    }
}
