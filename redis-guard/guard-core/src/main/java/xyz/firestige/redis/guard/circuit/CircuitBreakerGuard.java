package xyz.firestige.redis.guard.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.CircuitBreaker;
import xyz.firestige.redis.guard.api.CircuitBreakerSnapshot;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.exception.CircuitOpenException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 用熔断器包裹一次调用
 *
 * <p>流程：canExecute 检查 → 执行 → recordSuccess / recordFailure。
 * 只有被跟踪的异常类型会计入失败；其余异常（含 Error）只归还探测名额，随后透传。
 * 业务异常总是原样抛出。
 *
 * <pre>{@code
 * String answer = guard.execute("llm_api", () -> client.complete(prompt), () -> "service unavailable");
 * }</pre>
 */
public class CircuitBreakerGuard {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerGuard.class);

    private final CircuitBreakerRegistry registry;
    private final List<Class<? extends Throwable>> trackedExceptions;
    private final GuardMetricsRecorder metricsRecorder;

    public CircuitBreakerGuard(CircuitBreakerRegistry registry) {
        this(registry, List.of(Exception.class), GuardMetricsRecorder.noop());
    }

    public CircuitBreakerGuard(CircuitBreakerRegistry registry,
                               List<Class<? extends Throwable>> trackedExceptions,
                               GuardMetricsRecorder metricsRecorder) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.trackedExceptions = List.copyOf(trackedExceptions);
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    public <T> T execute(String breakerName, Callable<T> call) throws Exception {
        return execute(breakerName, call, null);
    }

    /**
     * @param breakerName 熔断器名称，未注册时不加保护直接执行
     * @param call 被保护的调用
     * @param fallback 熔断时的降级结果，为 null 时抛出 {@link CircuitOpenException}
     */
    public <T> T execute(String breakerName, Callable<T> call, Supplier<T> fallback) throws Exception {
        Optional<CircuitBreaker> found = registry.find(breakerName);
        if (found.isEmpty()) {
            log.warn("Circuit breaker '{}' not found, executing without protection", breakerName);
            return call.call();
        }
        CircuitBreaker breaker = found.get();

        if (!breaker.canExecute()) {
            metricsRecorder.onCallRejected(breakerName);
            if (fallback != null) {
                log.info("Circuit '{}' open, using fallback", breakerName);
                return fallback.get();
            }
            CircuitBreakerSnapshot snapshot = breaker.getState();
            throw new CircuitOpenException(breakerName, snapshot.state(), snapshot.recoveryTimeout());
        }

        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            if (isTracked(e)) {
                breaker.recordFailure();
            } else {
                breaker.releaseProbe();
            }
            throw e;
        } catch (Error e) {
            breaker.releaseProbe();
            throw e;
        }
        breaker.recordSuccess();
        return result;
    }

    private boolean isTracked(Throwable error) {
        for (Class<? extends Throwable> type : trackedExceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
