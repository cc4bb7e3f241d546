package xyz.firestige.redis.guard.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.CircuitBreaker;
import xyz.firestige.redis.guard.api.CircuitBreakerSnapshot;
import xyz.firestige.redis.guard.api.CircuitState;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于互斥锁的熔断器实现
 *
 * <p>所有读-改-写（canExecute / recordSuccess / recordFailure）都在同一把锁内完成，
 * 因此同一进程内的状态迁移严格有序。状态只保存在本实例中，不跨进程共享。
 *
 * <pre>{@code
 * CircuitBreaker breaker = new DefaultCircuitBreaker("llm_api", CircuitBreakerConfig.defaults());
 * if (breaker.canExecute()) {
 *     try {
 *         result = callExternalApi();
 *         breaker.recordSuccess();
 *     } catch (IOException e) {
 *         breaker.recordFailure();
 *         throw e;
 *     }
 * }
 * }</pre>
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final GuardMetricsRecorder metricsRecorder;
    private final ReentrantLock lock = new ReentrantLock();

    // 以下字段只在 lock 内读写
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenCallCount;
    private Instant lastFailureTime;

    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), GuardMetricsRecorder.noop());
    }

    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock,
                                 GuardMetricsRecorder metricsRecorder) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    @Override
    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public boolean canExecute() {
        CircuitState from;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (lastFailureTime != null && recoveryElapsed()) {
                        from = state;
                        toHalfOpen();
                        // 本次调用即第一个探测
                        halfOpenCallCount++;
                        break;
                    }
                    return false;
                case HALF_OPEN:
                    if (halfOpenCallCount < config.halfOpenMaxCalls()) {
                        halfOpenCallCount++;
                        return true;
                    }
                    return false;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
        metricsRecorder.onStateTransition(name, from, CircuitState.HALF_OPEN);
        return true;
    }

    @Override
    public void recordSuccess() {
        boolean closed = false;
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= config.halfOpenMaxCalls()) {
                    toClosed();
                    closed = true;
                }
            }
            failureCount = 0;
        } finally {
            lock.unlock();
        }
        if (closed) {
            metricsRecorder.onStateTransition(name, CircuitState.HALF_OPEN, CircuitState.CLOSED);
        }
    }

    @Override
    public void recordFailure() {
        CircuitState from = null;
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && failureCount >= config.failureThreshold())) {
                from = state;
                toOpen();
            }
        } finally {
            lock.unlock();
        }
        if (from != null) {
            metricsRecorder.onStateTransition(name, from, CircuitState.OPEN);
        }
    }

    @Override
    public void releaseProbe() {
        lock.lock();
        try {
            // 已计入成功的探测不归还
            if (state == CircuitState.HALF_OPEN && halfOpenCallCount > successCount) {
                halfOpenCallCount--;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot getState() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(name, state, failureCount, successCount, halfOpenCallCount,
                    config.failureThreshold(), config.recoveryTimeout(), config.halfOpenMaxCalls(), lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        CircuitState from;
        lock.lock();
        try {
            from = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            halfOpenCallCount = 0;
            lastFailureTime = null;
        } finally {
            lock.unlock();
        }
        if (from != CircuitState.CLOSED) {
            log.info("Circuit breaker '{}' reset to CLOSED", name);
            metricsRecorder.onStateTransition(name, from, CircuitState.CLOSED);
        }
    }

    private boolean recoveryElapsed() {
        Duration elapsed = Duration.between(lastFailureTime, clock.instant());
        return elapsed.compareTo(config.recoveryTimeout()) >= 0;
    }

    private void toOpen() {
        state = CircuitState.OPEN;
        log.warn("Circuit breaker '{}' OPENED after {} failures. Recovery in {}s",
                name, failureCount, config.recoveryTimeout().toSeconds());
    }

    private void toHalfOpen() {
        state = CircuitState.HALF_OPEN;
        halfOpenCallCount = 0;
        successCount = 0;
        log.info("Circuit breaker '{}' testing recovery (HALF-OPEN)", name);
    }

    private void toClosed() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        halfOpenCallCount = 0;
        log.info("Circuit breaker '{}' recovered (CLOSED)", name);
    }

    @Override
    public String toString() {
        return "DefaultCircuitBreaker{name='" + name + "', config=" + config + '}';
    }
}
