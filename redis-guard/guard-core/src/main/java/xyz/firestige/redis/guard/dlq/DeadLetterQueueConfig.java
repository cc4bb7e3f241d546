package xyz.firestige.redis.guard.dlq;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 死信队列配置
 *
 * <h3>使用示例</h3>
 * <pre>{@code
 * DeadLetterQueueConfig config = DeadLetterQueueConfig.builder()
 *     .maxRetries(5)
 *     .retryDelays(List.of(Duration.ofSeconds(10), Duration.ofMinutes(1)))
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public class DeadLetterQueueConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final List<Duration> DEFAULT_RETRY_DELAYS =
            List.of(Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(900));
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(7);
    public static final String DEFAULT_KEY_PREFIX = "redis-guard";

    /** retryDelays 为空时使用的退避时间 */
    public static final Duration FALLBACK_RETRY_DELAY = Duration.ofSeconds(60);

    private final int maxRetries;
    private final List<Duration> retryDelays;
    private final Duration retention;
    private final String keyPrefix;
    private final int maxDeadLetters;

    private DeadLetterQueueConfig(Builder builder) {
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + builder.maxRetries);
        }
        if (builder.maxDeadLetters < 0) {
            throw new IllegalArgumentException("maxDeadLetters must be >= 0, got " + builder.maxDeadLetters);
        }
        Objects.requireNonNull(builder.retryDelays, "retryDelays cannot be null");
        for (Duration delay : builder.retryDelays) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("retryDelays must be non-negative, got " + builder.retryDelays);
            }
        }
        this.maxRetries = builder.maxRetries;
        this.retryDelays = List.copyOf(builder.retryDelays);
        this.retention = Objects.requireNonNull(builder.retention, "retention cannot be null");
        this.keyPrefix = Objects.requireNonNull(builder.keyPrefix, "keyPrefix cannot be null");
        this.maxDeadLetters = builder.maxDeadLetters;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DeadLetterQueueConfig defaults() {
        return builder().build();
    }

    /**
     * 第 retryCount 次失败对应的退避时间，超出列表长度时复用最后一个值
     */
    public Duration delayFor(int retryCount) {
        if (retryDelays.isEmpty()) {
            return FALLBACK_RETRY_DELAY;
        }
        int index = Math.min(Math.max(retryCount, 0), retryDelays.size() - 1);
        return retryDelays.get(index);
    }

    public String deadLettersKey() {
        return keyPrefix + ":dlq:dead_letters";
    }

    public String retryQueueKey() {
        return keyPrefix + ":dlq:retry_queue";
    }

    public String statsKey() {
        return keyPrefix + ":dlq:stats";
    }

    public int getMaxRetries() { return maxRetries; }
    public List<Duration> getRetryDelays() { return retryDelays; }
    public Duration getRetention() { return retention; }
    public String getKeyPrefix() { return keyPrefix; }
    public int getMaxDeadLetters() { return maxDeadLetters; }

    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private List<Duration> retryDelays = DEFAULT_RETRY_DELAYS;
        private Duration retention = DEFAULT_RETENTION;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private int maxDeadLetters;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelays(List<Duration> retryDelays) {
            this.retryDelays = retryDelays;
            return this;
        }

        public Builder retention(Duration retention) {
            this.retention = retention;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        /**
         * 死信归档的容量上限，0 表示不限制
         */
        public Builder maxDeadLetters(int maxDeadLetters) {
            this.maxDeadLetters = maxDeadLetters;
            return this;
        }

        public DeadLetterQueueConfig build() {
            return new DeadLetterQueueConfig(this);
        }
    }
}
