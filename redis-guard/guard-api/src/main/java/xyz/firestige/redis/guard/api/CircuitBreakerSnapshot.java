package xyz.firestige.redis.guard.api;

import java.time.Duration;
import java.time.Instant;

/**
 * 熔断器状态快照（只读，用于观测）
 *
 * @param name 熔断器名称（通常是被保护的依赖名）
 * @param state 当前状态
 * @param failureCount 连续失败次数
 * @param successCount HALF_OPEN 状态下的成功次数
 * @param halfOpenCallCount HALF_OPEN 状态下已放行的探测次数
 * @param failureThreshold 打开熔断的失败阈值
 * @param recoveryTimeout OPEN 到 HALF_OPEN 的等待时间
 * @param halfOpenMaxCalls HALF_OPEN 状态下的最大探测次数
 * @param lastFailureTime 最近一次失败时间，从未失败时为 null
 * @since 1.0
 */
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        int halfOpenCallCount,
        int failureThreshold,
        Duration recoveryTimeout,
        int halfOpenMaxCalls,
        Instant lastFailureTime) {

    public boolean isOpen() {
        return state == CircuitState.OPEN;
    }
}
