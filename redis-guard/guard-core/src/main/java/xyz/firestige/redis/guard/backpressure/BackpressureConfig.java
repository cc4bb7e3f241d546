package xyz.firestige.redis.guard.backpressure;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 背压配置
 *
 * <p>队列长度按 {@link #getKeyPatterns()} 的顺序探测，{@code {queue}} 会被替换为队列名，
 * 返回第一个非零长度。
 *
 * @since 1.0
 */
public class BackpressureConfig {

    public static final String QUEUE_PLACEHOLDER = "{queue}";
    public static final int DEFAULT_THRESHOLD = 100;
    public static final List<String> DEFAULT_KEY_PATTERNS =
            List.of("queue:" + QUEUE_PLACEHOLDER, "redis-guard:" + QUEUE_PLACEHOLDER, QUEUE_PLACEHOLDER);
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(300);

    private final int defaultThreshold;
    private final Map<String, Integer> thresholds;
    private final List<String> keyPatterns;
    private final Duration checkInterval;
    private final Duration maxWait;
    private final double targetPressure;

    private BackpressureConfig(Builder builder) {
        if (builder.defaultThreshold < 0) {
            throw new IllegalArgumentException("defaultThreshold must be >= 0, got " + builder.defaultThreshold);
        }
        builder.thresholds.forEach((queue, threshold) -> {
            if (threshold == null || threshold < 0) {
                throw new IllegalArgumentException("threshold for " + queue + " must be >= 0, got " + threshold);
            }
        });
        if (builder.keyPatterns == null || builder.keyPatterns.isEmpty()) {
            throw new IllegalArgumentException("keyPatterns cannot be empty");
        }
        this.defaultThreshold = builder.defaultThreshold;
        this.thresholds = Map.copyOf(builder.thresholds);
        this.keyPatterns = List.copyOf(builder.keyPatterns);
        this.checkInterval = Objects.requireNonNull(builder.checkInterval, "checkInterval cannot be null");
        this.maxWait = Objects.requireNonNull(builder.maxWait, "maxWait cannot be null");
        this.targetPressure = builder.targetPressure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackpressureConfig defaults() {
        return builder().build();
    }

    public int getDefaultThreshold() { return defaultThreshold; }
    public Map<String, Integer> getThresholds() { return thresholds; }
    public List<String> getKeyPatterns() { return keyPatterns; }
    public Duration getCheckInterval() { return checkInterval; }
    public Duration getMaxWait() { return maxWait; }
    public double getTargetPressure() { return targetPressure; }

    public static class Builder {
        private int defaultThreshold = DEFAULT_THRESHOLD;
        private final Map<String, Integer> thresholds = new LinkedHashMap<>();
        private List<String> keyPatterns = DEFAULT_KEY_PATTERNS;
        private Duration checkInterval = DEFAULT_CHECK_INTERVAL;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private double targetPressure = 0.8;

        public Builder defaultThreshold(int defaultThreshold) {
            this.defaultThreshold = defaultThreshold;
            return this;
        }

        public Builder threshold(String queueName, int threshold) {
            this.thresholds.put(queueName, threshold);
            return this;
        }

        public Builder thresholds(Map<String, Integer> thresholds) {
            this.thresholds.putAll(thresholds);
            return this;
        }

        public Builder keyPatterns(List<String> keyPatterns) {
            this.keyPatterns = keyPatterns;
            return this;
        }

        public Builder checkInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder targetPressure(double targetPressure) {
            this.targetPressure = targetPressure;
            return this;
        }

        public BackpressureConfig build() {
            return new BackpressureConfig(this);
        }
    }
}
