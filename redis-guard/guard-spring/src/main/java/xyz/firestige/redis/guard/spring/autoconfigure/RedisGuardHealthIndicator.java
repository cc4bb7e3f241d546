package xyz.firestige.redis.guard.spring.autoconfigure;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import xyz.firestige.redis.guard.api.BackpressureController;
import xyz.firestige.redis.guard.api.CircuitBreakerSnapshot;
import xyz.firestige.redis.guard.api.DeadLetterQueue;
import xyz.firestige.redis.guard.api.DeadLetterStats;
import xyz.firestige.redis.guard.circuit.CircuitBreakerRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Guard 健康检查指示器
 *
 * <p>任一熔断器 OPEN 时为 DEGRADED；读取死信统计或队列压力失败时为 DOWN。
 *
 * @since 1.0
 */
public class RedisGuardHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "At least one circuit breaker is open");

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final DeadLetterQueue deadLetterQueue;
    private final BackpressureController backpressureController;

    public RedisGuardHealthIndicator(CircuitBreakerRegistry circuitBreakerRegistry,
                                     DeadLetterQueue deadLetterQueue,
                                     BackpressureController backpressureController) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.deadLetterQueue = deadLetterQueue;
        this.backpressureController = backpressureController;
    }

    @Override
    public Health health() {
        Map<String, Object> circuits = new LinkedHashMap<>();
        circuitBreakerRegistry.getAllStates().forEach((name, snapshot) -> circuits.put(name, describe(snapshot)));
        List<String> openCircuits = circuitBreakerRegistry.getOpenCircuits();

        try {
            DeadLetterStats stats = deadLetterQueue.getStats();
            Map<String, Double> pressures = backpressureController.getAllPressures();

            Health.Builder builder = openCircuits.isEmpty() ? Health.up() : Health.status(DEGRADED);
            return builder
                .withDetail("circuitBreakers", circuits)
                .withDetail("openCircuits", openCircuits)
                .withDetail("deadLetterQueue", stats)
                .withDetail("queuePressures", pressures)
                .build();
        } catch (Exception e) {
            return Health.down(e)
                .withDetail("circuitBreakers", circuits)
                .withDetail("openCircuits", openCircuits)
                .build();
        }
    }

    private static Map<String, Object> describe(CircuitBreakerSnapshot snapshot) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("state", snapshot.state().getValue());
        detail.put("failureCount", snapshot.failureCount());
        detail.put("failureThreshold", snapshot.failureThreshold());
        detail.put("recoveryTimeout", snapshot.recoveryTimeout().toSeconds());
        if (snapshot.lastFailureTime() != null) {
            detail.put("lastFailureTime", snapshot.lastFailureTime().toString());
        }
        return detail;
    }
}
