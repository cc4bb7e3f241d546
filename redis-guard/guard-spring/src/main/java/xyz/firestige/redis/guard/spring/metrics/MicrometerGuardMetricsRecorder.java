package xyz.firestige.redis.guard.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.redis.guard.api.CircuitState;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.IdempotencyStatus;

import java.time.Duration;

/**
 * 基于 Micrometer 的指标记录器
 * <p>
 * 记录以下指标：
 * - redis_guard_circuit_transitions: 熔断器状态迁移（tag: breaker, from, to）
 * - redis_guard_circuit_rejections: 熔断拒绝的调用（tag: breaker）
 * - redis_guard_dlq_retries_scheduled: 安排的重试（tag: task）
 * - redis_guard_dlq_dead_letters: 进入死信的任务（tag: task）
 * - redis_guard_dlq_retry_outcomes: 重试结果（tag: task, outcome）
 * - redis_guard_idempotency_duplicates: 幂等命中（tag: status）
 * - redis_guard_backpressure_wait: 等待队列容量的耗时（tag: queue, outcome）
 *
 * @since 1.0
 */
public class MicrometerGuardMetricsRecorder implements GuardMetricsRecorder {

    private final MeterRegistry registry;

    public MicrometerGuardMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStateTransition(String breakerName, CircuitState from, CircuitState to) {
        Counter.builder("redis_guard_circuit_transitions")
            .description("Circuit breaker state transitions")
            .tag("breaker", breakerName)
            .tag("from", from.getValue())
            .tag("to", to.getValue())
            .register(registry)
            .increment();
    }

    @Override
    public void onCallRejected(String breakerName) {
        Counter.builder("redis_guard_circuit_rejections")
            .description("Calls rejected by an open circuit")
            .tag("breaker", breakerName)
            .register(registry)
            .increment();
    }

    @Override
    public void onRetryScheduled(String taskName, int retryCount) {
        Counter.builder("redis_guard_dlq_retries_scheduled")
            .description("Failed tasks scheduled for retry")
            .tag("task", taskName)
            .register(registry)
            .increment();
    }

    @Override
    public void onDeadLettered(String taskName) {
        Counter.builder("redis_guard_dlq_dead_letters")
            .description("Tasks moved to the dead letter archive")
            .tag("task", taskName)
            .register(registry)
            .increment();
    }

    @Override
    public void onRetryOutcome(String taskName, boolean success) {
        Counter.builder("redis_guard_dlq_retry_outcomes")
            .description("Retry attempts by outcome")
            .tag("task", taskName)
            .tag("outcome", success ? "success" : "failure")
            .register(registry)
            .increment();
    }

    @Override
    public void onDuplicate(IdempotencyStatus status) {
        Counter.builder("redis_guard_idempotency_duplicates")
            .description("Duplicate idempotency keys observed")
            .tag("status", status != null ? status.getValue() : "unknown")
            .register(registry)
            .increment();
    }

    @Override
    public void onBackpressureWait(String queueName, Duration waited, boolean timedOut) {
        Timer.builder("redis_guard_backpressure_wait")
            .description("Time spent waiting for queue capacity")
            .tag("queue", queueName)
            .tag("outcome", timedOut ? "timeout" : "relieved")
            .register(registry)
            .record(waited);
    }
}
