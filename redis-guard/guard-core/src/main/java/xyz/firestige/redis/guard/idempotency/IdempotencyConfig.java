package xyz.firestige.redis.guard.idempotency;

import java.time.Duration;
import java.util.Objects;

/**
 * 幂等配置
 *
 * @since 1.0
 */
public class IdempotencyConfig {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_ERROR_TTL_CAP = Duration.ofMinutes(5);
    public static final String DEFAULT_KEY_PREFIX = "redis-guard";
    public static final String DEFAULT_DEDUP_NAMESPACE = "content";
    public static final Duration DEFAULT_DEDUP_TTL = Duration.ofDays(7);

    private final Duration defaultTtl;
    private final Duration errorTtlCap;
    private final String keyPrefix;
    private final String dedupNamespace;
    private final Duration dedupTtl;

    private IdempotencyConfig(Builder builder) {
        this.defaultTtl = positive(builder.defaultTtl, "defaultTtl");
        this.errorTtlCap = positive(builder.errorTtlCap, "errorTtlCap");
        this.keyPrefix = Objects.requireNonNull(builder.keyPrefix, "keyPrefix cannot be null");
        this.dedupNamespace = Objects.requireNonNull(builder.dedupNamespace, "dedupNamespace cannot be null");
        this.dedupTtl = positive(builder.dedupTtl, "dedupTtl");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static IdempotencyConfig defaults() {
        return builder().build();
    }

    /**
     * 未显式指定时错误记录的 TTL：min(errorTtlCap, defaultTtl)
     */
    public Duration errorTtl() {
        return errorTtlCap.compareTo(defaultTtl) <= 0 ? errorTtlCap : defaultTtl;
    }

    public String idempotencyKey(String key) {
        return keyPrefix + ":idempotency:" + key;
    }

    public String dedupKey(String namespace, String contentHash) {
        return keyPrefix + ":dedup:" + namespace + ":" + contentHash;
    }

    public Duration getDefaultTtl() { return defaultTtl; }
    public Duration getErrorTtlCap() { return errorTtlCap; }
    public String getKeyPrefix() { return keyPrefix; }
    public String getDedupNamespace() { return dedupNamespace; }
    public Duration getDedupTtl() { return dedupTtl; }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    public static class Builder {
        private Duration defaultTtl = DEFAULT_TTL;
        private Duration errorTtlCap = DEFAULT_ERROR_TTL_CAP;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private String dedupNamespace = DEFAULT_DEDUP_NAMESPACE;
        private Duration dedupTtl = DEFAULT_DEDUP_TTL;

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder errorTtlCap(Duration errorTtlCap) {
            this.errorTtlCap = errorTtlCap;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        public Builder dedupNamespace(String dedupNamespace) {
            this.dedupNamespace = dedupNamespace;
            return this;
        }

        public Builder dedupTtl(Duration dedupTtl) {
            this.dedupTtl = dedupTtl;
            return this;
        }

        public IdempotencyConfig build() {
            return new IdempotencyConfig(this);
        }
    }
}
