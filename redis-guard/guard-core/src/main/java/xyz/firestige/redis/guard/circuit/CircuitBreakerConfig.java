package xyz.firestige.redis.guard.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * 熔断器参数
 *
 * @param failureThreshold 连续失败多少次后打开熔断（>= 1）
 * @param recoveryTimeout 打开后多久允许探测
 * @param halfOpenMaxCalls HALF_OPEN 状态下的探测次数，也是恢复所需的成功次数（>= 1）
 */
public record CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 3;

    public CircuitBreakerConfig {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (recoveryTimeout.isZero() || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, got " + recoveryTimeout);
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1, got " + halfOpenMaxCalls);
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_HALF_OPEN_MAX_CALLS);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls);
    }

    public CircuitBreakerConfig withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls);
    }
}
