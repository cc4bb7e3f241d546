package xyz.firestige.redis.guard.api;

import java.time.Duration;
import java.util.Map;

/**
 * 背压控制器
 *
 * <p>根据队列深度判断生产者是否需要暂停或减速：
 * <ul>
 *   <li>{@link #checkBackpressure(String)} - 硬闸门，压力超过 1.0 时为 true</li>
 *   <li>{@link #shouldThrottle(String)} - 软信号，压力达到节流阈值时为 true</li>
 *   <li>{@link #getRecommendedDelay(String)} - 连续的减速建议</li>
 *   <li>{@link #waitForCapacity(String)} - 唯一会阻塞的操作，轮询直到压力回落或超时</li>
 * </ul>
 * 压力 = 队列长度 / 阈值，每次调用实时计算，不做持久化。
 *
 * @since 1.0
 */
public interface BackpressureController {

    /** 未单独配置阈值的队列使用的键 */
    String DEFAULT_QUEUE = "default";

    double DEFAULT_THROTTLE_THRESHOLD = 0.7;

    double DEFAULT_TARGET_PRESSURE = 0.8;

    Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    /**
     * 设置队列阈值
     */
    void setThreshold(String queueName, int threshold);

    /**
     * @return 队列阈值，未配置时返回 default 阈值
     */
    int getThreshold(String queueName);

    /**
     * 按配置的多种命名约定依次查询队列长度，返回第一个非零值
     *
     * @return 队列长度，全部为空时返回 0
     */
    long getQueueLength(String queueName);

    /**
     * @return 队列长度 / 阈值，阈值为 0 时返回 0
     */
    double getPressureLevel(String queueName);

    /**
     * @return 压力严格大于 1.0 时返回 true
     */
    boolean checkBackpressure(String queueName);

    default boolean shouldThrottle(String queueName) {
        return shouldThrottle(queueName, DEFAULT_THROTTLE_THRESHOLD);
    }

    /**
     * @return 压力大于等于 throttleThreshold 时返回 true
     */
    boolean shouldThrottle(String queueName, double throttleThreshold);

    default Duration getRecommendedDelay(String queueName) {
        return getRecommendedDelay(queueName, Duration.ZERO, DEFAULT_MAX_DELAY);
    }

    /**
     * 压力低于 0.5 时返回 baseDelay；0.5 到 1.0 之间线性插值到 maxDelay；超过 1.0 时为 maxDelay
     */
    Duration getRecommendedDelay(String queueName, Duration baseDelay, Duration maxDelay);

    /**
     * 使用默认检查间隔、最长等待和目标压力等待容量
     *
     * @return 实际等待时长
     * @throws InterruptedException 等待期间线程被中断
     */
    Duration waitForCapacity(String queueName) throws InterruptedException;

    /**
     * 轮询压力直到低于 targetPressure
     *
     * @param queueName 队列名
     * @param checkInterval 两次检查之间的睡眠时间
     * @param maxWait 最长等待时间
     * @param targetPressure 目标压力
     * @return 实际等待时长
     * @throws xyz.firestige.redis.guard.exception.BackpressureTimeoutException 累计等待达到 maxWait 压力仍未回落
     * @throws InterruptedException 等待期间线程被中断
     */
    Duration waitForCapacity(String queueName, Duration checkInterval, Duration maxWait, double targetPressure)
            throws InterruptedException;

    /**
     * @return 所有已配置队列（不含 default）的当前压力
     */
    Map<String, Double> getAllPressures();
}
