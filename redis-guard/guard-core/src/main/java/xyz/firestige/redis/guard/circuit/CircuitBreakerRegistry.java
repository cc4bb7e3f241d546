package xyz.firestige.redis.guard.circuit;

import xyz.firestige.redis.guard.api.CircuitBreaker;
import xyz.firestige.redis.guard.api.CircuitBreakerSnapshot;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 熔断器注册表
 *
 * <p>每个被保护的依赖对应一个独立的熔断器。注册表由应用显式创建并注入，不使用全局静态状态。
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final GuardMetricsRecorder metricsRecorder;

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults(), Clock.systemUTC(), GuardMetricsRecorder.noop());
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock,
                                  GuardMetricsRecorder metricsRecorder) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    /**
     * 注册（或替换）指定名称的熔断器
     */
    public CircuitBreaker register(String name, CircuitBreakerConfig config) {
        CircuitBreaker breaker = new DefaultCircuitBreaker(name, config, clock, metricsRecorder);
        breakers.put(name, breaker);
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * 获取熔断器，不存在时以默认配置创建
     */
    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name,
                n -> new DefaultCircuitBreaker(n, defaultConfig, clock, metricsRecorder));
    }

    public Collection<CircuitBreaker> getAll() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    /**
     * @return 名称到状态快照的映射，按名称排序
     */
    public Map<String, CircuitBreakerSnapshot> getAllStates() {
        Map<String, CircuitBreakerSnapshot> states = new LinkedHashMap<>();
        breakers.keySet().stream().sorted()
                .forEach(name -> states.put(name, breakers.get(name).getState()));
        return states;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    /**
     * @return 当前处于 OPEN 状态的熔断器名称
     */
    public List<String> getOpenCircuits() {
        List<String> open = new ArrayList<>();
        getAllStates().forEach((name, snapshot) -> {
            if (snapshot.isOpen()) {
                open.add(name);
            }
        });
        return open;
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig;
    }
}
