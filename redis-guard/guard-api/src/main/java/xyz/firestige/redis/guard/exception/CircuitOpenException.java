package xyz.firestige.redis.guard.exception;

import xyz.firestige.redis.guard.api.CircuitState;

import java.time.Duration;

/**
 * 熔断器处于 OPEN（或 HALF_OPEN 探测名额已满）时拒绝调用
 *
 * <p>可通过降级逻辑处理，或等待恢复超时后重试。
 *
 * @since 1.0
 */
public class CircuitOpenException extends GuardException {

    private final String breakerName;
    private final CircuitState state;
    private final Duration recoveryTimeout;

    public CircuitOpenException(String breakerName, CircuitState state, Duration recoveryTimeout) {
        super("Circuit breaker '" + breakerName + "' is " + state.getValue()
                + ". Service will recover in " + recoveryTimeout.toSeconds() + "s");
        this.breakerName = breakerName;
        this.state = state;
        this.recoveryTimeout = recoveryTimeout;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitState getState() {
        return state;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
}
