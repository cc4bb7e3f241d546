package xyz.firestige.redis.guard.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.guard.api.BackpressureController;
import xyz.firestige.redis.guard.api.DeadLetterQueue;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.IdempotencyManager;
import xyz.firestige.redis.guard.api.NamedTaskHandler;
import xyz.firestige.redis.guard.api.RedisClient;
import xyz.firestige.redis.guard.backpressure.BackpressureConfig;
import xyz.firestige.redis.guard.backpressure.RedisBackpressureController;
import xyz.firestige.redis.guard.backpressure.Sleeper;
import xyz.firestige.redis.guard.circuit.CircuitBreakerGuard;
import xyz.firestige.redis.guard.circuit.CircuitBreakerRegistry;
import xyz.firestige.redis.guard.dlq.DeadLetterQueueConfig;
import xyz.firestige.redis.guard.dlq.RedisDeadLetterQueue;
import xyz.firestige.redis.guard.dlq.RetryProcessor;
import xyz.firestige.redis.guard.dlq.TaskHandlerRegistry;
import xyz.firestige.redis.guard.idempotency.ContentDeduplicator;
import xyz.firestige.redis.guard.idempotency.IdempotencyConfig;
import xyz.firestige.redis.guard.idempotency.IdempotentExecutor;
import xyz.firestige.redis.guard.idempotency.RedisIdempotencyManager;
import xyz.firestige.redis.guard.spring.lifecycle.RetryProcessorLifecycle;
import xyz.firestige.redis.guard.spring.metrics.MicrometerGuardMetricsRecorder;
import xyz.firestige.redis.guard.spring.redis.SpringRedisClient;

import java.time.Clock;
import java.util.List;

/**
 * Redis Guard 自动配置
 *
 * <p>所有 Bean 均为 {@code @ConditionalOnMissingBean}，应用可以替换任意一部分。
 *
 * @since 1.0
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@ConditionalOnClass(StringRedisTemplate.class)
@ConditionalOnProperty(prefix = "redis.guard", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RedisGuardProperties.class)
public class RedisGuardAutoConfiguration {

    /**
     * RedisClient Bean（基于 Spring StringRedisTemplate）
     *
     * <p>必须存在 StringRedisTemplate；单进程场景可以自行声明名为 guardRedisClient 的
     * {@link xyz.firestige.redis.guard.store.InMemoryRedisClient}。
     */
    @Bean(name = "guardRedisClient")
    @ConditionalOnMissingBean(name = "guardRedisClient")
    public RedisClient guardRedisClient(StringRedisTemplate redisTemplate) {
        return new SpringRedisClient(redisTemplate);
    }

    /**
     * 没有 Micrometer 时的空指标记录器
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardMetricsRecorder guardMetricsRecorder() {
        return GuardMetricsRecorder.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(RedisGuardProperties properties,
                                                         GuardMetricsRecorder guardMetricsRecorder) {
        RedisGuardProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
            settings.getDefaults().toConfig(), Clock.systemUTC(), guardMetricsRecorder);
        settings.getInstances().forEach((name, breaker) -> registry.register(name, breaker.toConfig()));
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerGuard circuitBreakerGuard(CircuitBreakerRegistry circuitBreakerRegistry,
                                                   GuardMetricsRecorder guardMetricsRecorder) {
        return new CircuitBreakerGuard(circuitBreakerRegistry, List.of(Exception.class), guardMetricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterQueue deadLetterQueue(@Qualifier("guardRedisClient") RedisClient guardRedisClient,
                                           RedisGuardProperties properties,
                                           GuardMetricsRecorder guardMetricsRecorder) {
        RedisGuardProperties.Dlq dlq = properties.getDlq();
        DeadLetterQueueConfig config = DeadLetterQueueConfig.builder()
            .keyPrefix(properties.getKeyPrefix())
            .maxRetries(dlq.getMaxRetries())
            .retryDelays(dlq.getRetryDelays())
            .retention(dlq.getRetention())
            .maxDeadLetters(dlq.getMaxDeadLetters())
            .build();
        return new RedisDeadLetterQueue(guardRedisClient, config, Clock.systemUTC(), guardMetricsRecorder);
    }

    /**
     * 处理器注册表，自动收集容器中的 {@link NamedTaskHandler}
     */
    @Bean
    @ConditionalOnMissingBean
    public TaskHandlerRegistry taskHandlerRegistry(ObjectProvider<NamedTaskHandler> handlers) {
        TaskHandlerRegistry registry = new TaskHandlerRegistry();
        handlers.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryProcessor retryProcessor(DeadLetterQueue deadLetterQueue,
                                         TaskHandlerRegistry taskHandlerRegistry,
                                         RedisGuardProperties properties,
                                         GuardMetricsRecorder guardMetricsRecorder) {
        RedisGuardProperties.Processor processor = properties.getDlq().getProcessor();
        return new RetryProcessor(deadLetterQueue, taskHandlerRegistry,
            processor.getCheckInterval(), processor.getBatchSize(), guardMetricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "redis.guard.dlq.processor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RetryProcessorLifecycle retryProcessorLifecycle(RetryProcessor retryProcessor) {
        return new RetryProcessorLifecycle(retryProcessor);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackpressureController backpressureController(@Qualifier("guardRedisClient") RedisClient guardRedisClient,
                                                         RedisGuardProperties properties,
                                                         GuardMetricsRecorder guardMetricsRecorder) {
        RedisGuardProperties.Backpressure backpressure = properties.getBackpressure();
        BackpressureConfig config = BackpressureConfig.builder()
            .defaultThreshold(backpressure.getDefaultThreshold())
            .thresholds(backpressure.getThresholds())
            .keyPatterns(backpressure.getKeyPatterns())
            .checkInterval(backpressure.getCheckInterval())
            .maxWait(backpressure.getMaxWait())
            .targetPressure(backpressure.getTargetPressure())
            .build();
        return new RedisBackpressureController(guardRedisClient, config, Sleeper.threadSleep(), guardMetricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyConfig idempotencyConfig(RedisGuardProperties properties) {
        RedisGuardProperties.Idempotency idempotency = properties.getIdempotency();
        return IdempotencyConfig.builder()
            .keyPrefix(properties.getKeyPrefix())
            .defaultTtl(idempotency.getDefaultTtl())
            .errorTtlCap(idempotency.getErrorTtl())
            .dedupNamespace(idempotency.getDedupNamespace())
            .dedupTtl(idempotency.getDedupTtl())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyManager idempotencyManager(@Qualifier("guardRedisClient") RedisClient guardRedisClient,
                                                 IdempotencyConfig idempotencyConfig,
                                                 GuardMetricsRecorder guardMetricsRecorder) {
        return new RedisIdempotencyManager(guardRedisClient, idempotencyConfig, guardMetricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotentExecutor idempotentExecutor(IdempotencyManager idempotencyManager) {
        return new IdempotentExecutor(idempotencyManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentDeduplicator contentDeduplicator(@Qualifier("guardRedisClient") RedisClient guardRedisClient,
                                                   IdempotencyConfig idempotencyConfig) {
        return new ContentDeduplicator(guardRedisClient, idempotencyConfig);
    }

    /**
     * 存在 Micrometer 时使用 {@link MicrometerGuardMetricsRecorder}
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public GuardMetricsRecorder guardMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistryProvider) {
            MeterRegistry registry = meterRegistryProvider.getIfAvailable();
            return registry != null
                ? new MicrometerGuardMetricsRecorder(registry)
                : GuardMetricsRecorder.noop();
        }
    }

    /**
     * 健康检查指示器（需要 Actuator）
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthIndicatorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RedisGuardHealthIndicator redisGuardHealthIndicator(CircuitBreakerRegistry circuitBreakerRegistry,
                                                                   DeadLetterQueue deadLetterQueue,
                                                                   BackpressureController backpressureController) {
            return new RedisGuardHealthIndicator(circuitBreakerRegistry, deadLetterQueue, backpressureController);
        }
    }
}
