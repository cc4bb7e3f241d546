package xyz.firestige.redis.guard.api;

import java.time.Duration;

/**
 * 指标记录器接口
 * <p>
 * 允许实现自定义的指标收集逻辑，例如集成 Micrometer、Prometheus 或其他监控系统。
 * 所有方法默认为空操作，实现方只需覆盖关心的事件。
 *
 * @since 1.0
 */
public interface GuardMetricsRecorder {

    /**
     * 熔断器状态迁移
     */
    default void onStateTransition(String breakerName, CircuitState from, CircuitState to) {
    }

    /**
     * 熔断器拒绝了一次调用
     */
    default void onCallRejected(String breakerName) {
    }

    /**
     * 失败任务被安排重试
     */
    default void onRetryScheduled(String taskName, int retryCount) {
    }

    /**
     * 失败任务进入死信归档
     */
    default void onDeadLettered(String taskName) {
    }

    /**
     * 重试处理器执行了一次重试
     */
    default void onRetryOutcome(String taskName, boolean success) {
    }

    /**
     * 幂等检查命中已有记录
     */
    default void onDuplicate(IdempotencyStatus status) {
    }

    /**
     * 一次容量等待结束
     */
    default void onBackpressureWait(String queueName, Duration waited, boolean timedOut) {
    }

    /**
     * 空操作实现（默认）
     *
     * @return 不执行任何操作的记录器
     */
    static GuardMetricsRecorder noop() {
        return new GuardMetricsRecorder() {
        };
    }
}
