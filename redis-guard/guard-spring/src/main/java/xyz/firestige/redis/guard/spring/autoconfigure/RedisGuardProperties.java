package xyz.firestige.redis.guard.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import xyz.firestige.redis.guard.backpressure.BackpressureConfig;
import xyz.firestige.redis.guard.circuit.CircuitBreakerConfig;
import xyz.firestige.redis.guard.dlq.DeadLetterQueueConfig;
import xyz.firestige.redis.guard.dlq.RetryProcessor;
import xyz.firestige.redis.guard.idempotency.IdempotencyConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Guard 配置属性
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "redis.guard")
public class RedisGuardProperties {

    /**
     * 是否启用 Redis Guard
     */
    private boolean enabled = true;

    /**
     * 所有 Redis Key 的前缀
     */
    private String keyPrefix = "redis-guard";

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Dlq dlq = new Dlq();

    private Backpressure backpressure = new Backpressure();

    private Idempotency idempotency = new Idempotency();

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Dlq getDlq() {
        return dlq;
    }

    public void setDlq(Dlq dlq) {
        this.dlq = dlq;
    }

    public Backpressure getBackpressure() {
        return backpressure;
    }

    public void setBackpressure(Backpressure backpressure) {
        this.backpressure = backpressure;
    }

    public Idempotency getIdempotency() {
        return idempotency;
    }

    public void setIdempotency(Idempotency idempotency) {
        this.idempotency = idempotency;
    }

    /**
     * 熔断器配置
     */
    public static class CircuitBreaker {

        /**
         * 未单独配置的熔断器使用的参数
         */
        private Breaker defaults = new Breaker();

        /**
         * 启动时预先注册的熔断器，key 为熔断器名称
         */
        private Map<String, Breaker> instances = new LinkedHashMap<>();

        public Breaker getDefaults() {
            return defaults;
        }

        public void setDefaults(Breaker defaults) {
            this.defaults = defaults;
        }

        public Map<String, Breaker> getInstances() {
            return instances;
        }

        public void setInstances(Map<String, Breaker> instances) {
            this.instances = instances;
        }
    }

    /**
     * 单个熔断器的参数
     */
    public static class Breaker {

        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;

        private Duration recoveryTimeout = CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT;

        private int halfOpenMaxCalls = CircuitBreakerConfig.DEFAULT_HALF_OPEN_MAX_CALLS;

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, halfOpenMaxCalls);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }
    }

    /**
     * 死信队列配置
     */
    public static class Dlq {

        private int maxRetries = DeadLetterQueueConfig.DEFAULT_MAX_RETRIES;

        /**
         * 第 N 次失败后的退避时间，超出部分复用最后一个值
         */
        private List<Duration> retryDelays = new ArrayList<>(DeadLetterQueueConfig.DEFAULT_RETRY_DELAYS);

        /**
         * 死信保留时长，超过后由 cleanup 清除
         */
        private Duration retention = DeadLetterQueueConfig.DEFAULT_RETENTION;

        /**
         * 死信归档容量上限，0 表示不限制
         */
        private int maxDeadLetters = 0;

        private Processor processor = new Processor();

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<Duration> getRetryDelays() {
            return retryDelays;
        }

        public void setRetryDelays(List<Duration> retryDelays) {
            this.retryDelays = retryDelays;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getMaxDeadLetters() {
            return maxDeadLetters;
        }

        public void setMaxDeadLetters(int maxDeadLetters) {
            this.maxDeadLetters = maxDeadLetters;
        }

        public Processor getProcessor() {
            return processor;
        }

        public void setProcessor(Processor processor) {
            this.processor = processor;
        }
    }

    /**
     * 后台重试处理器配置
     */
    public static class Processor {

        /**
         * 是否随应用启动重试处理器
         */
        private boolean enabled = true;

        private Duration checkInterval = RetryProcessor.DEFAULT_CHECK_INTERVAL;

        private int batchSize = RetryProcessor.DEFAULT_BATCH_SIZE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * 背压配置
     */
    public static class Backpressure {

        private int defaultThreshold = BackpressureConfig.DEFAULT_THRESHOLD;

        /**
         * 队列名到阈值的映射
         */
        private Map<String, Integer> thresholds = new LinkedHashMap<>();

        /**
         * 队列 Key 的候选模式，{queue} 替换为队列名
         */
        private List<String> keyPatterns = new ArrayList<>(BackpressureConfig.DEFAULT_KEY_PATTERNS);

        private Duration checkInterval = BackpressureConfig.DEFAULT_CHECK_INTERVAL;

        private Duration maxWait = BackpressureConfig.DEFAULT_MAX_WAIT;

        private double targetPressure = 0.8;

        public int getDefaultThreshold() {
            return defaultThreshold;
        }

        public void setDefaultThreshold(int defaultThreshold) {
            this.defaultThreshold = defaultThreshold;
        }

        public Map<String, Integer> getThresholds() {
            return thresholds;
        }

        public void setThresholds(Map<String, Integer> thresholds) {
            this.thresholds = thresholds;
        }

        public List<String> getKeyPatterns() {
            return keyPatterns;
        }

        public void setKeyPatterns(List<String> keyPatterns) {
            this.keyPatterns = keyPatterns;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }

        public double getTargetPressure() {
            return targetPressure;
        }

        public void setTargetPressure(double targetPressure) {
            this.targetPressure = targetPressure;
        }
    }

    /**
     * 幂等配置
     */
    public static class Idempotency {

        private Duration defaultTtl = IdempotencyConfig.DEFAULT_TTL;

        /**
         * 错误记录 TTL 的上限
         */
        private Duration errorTtl = IdempotencyConfig.DEFAULT_ERROR_TTL_CAP;

        private String dedupNamespace = IdempotencyConfig.DEFAULT_DEDUP_NAMESPACE;

        private Duration dedupTtl = IdempotencyConfig.DEFAULT_DEDUP_TTL;

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public Duration getErrorTtl() {
            return errorTtl;
        }

        public void setErrorTtl(Duration errorTtl) {
            this.errorTtl = errorTtl;
        }

        public String getDedupNamespace() {
            return dedupNamespace;
        }

        public void setDedupNamespace(String dedupNamespace) {
            this.dedupNamespace = dedupNamespace;
        }

        public Duration getDedupTtl() {
            return dedupTtl;
        }

        public void setDedupTtl(Duration dedupTtl) {
            this.dedupTtl = dedupTtl;
        }
    }
}
