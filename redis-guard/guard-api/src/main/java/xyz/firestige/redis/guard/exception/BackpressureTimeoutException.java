package xyz.firestige.redis.guard.exception;

import java.time.Duration;

/**
 * 等待容量超时：累计等待达到 maxWait 时压力仍未降到目标值
 *
 * <p>由调用方决定放弃、稍后重试还是继续提交。
 *
 * @since 1.0
 */
public class BackpressureTimeoutException extends GuardException {

    private final String queueName;
    private final Duration waited;
    private final double pressure;

    public BackpressureTimeoutException(String queueName, Duration waited, double pressure) {
        super(String.format("Queue %s still overloaded after %ss (pressure: %.1f%%)",
                queueName, waited.toMillis() / 1000.0, pressure * 100));
        this.queueName = queueName;
        this.waited = waited;
        this.pressure = pressure;
    }

    public String getQueueName() {
        return queueName;
    }

    public Duration getWaited() {
        return waited;
    }

    public double getPressure() {
        return pressure;
    }
}
