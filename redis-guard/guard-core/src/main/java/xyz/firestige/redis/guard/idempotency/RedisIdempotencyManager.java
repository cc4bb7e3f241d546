package xyz.firestige.redis.guard.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.ContentCheck;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.IdempotencyCheck;
import xyz.firestige.redis.guard.api.IdempotencyManager;
import xyz.firestige.redis.guard.api.IdempotencyRecord;
import xyz.firestige.redis.guard.api.IdempotencyStatus;
import xyz.firestige.redis.guard.api.RedisClient;
import xyz.firestige.redis.guard.exception.GuardSerializationException;
import xyz.firestige.redis.guard.support.JsonSupport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 Redis 的幂等管理器
 *
 * <p>记录存放在 {@code <prefix>:idempotency:<key>}，值为 JSON：
 * {@code {"status":"processing|complete|error","result":...,"error":"..."}}。
 *
 * <p>{@link #checkAndSet} 基于 SET NX 实现，同一个 key 只有一个调用方能拿到“首次”结果。
 *
 * @since 1.0
 */
public class RedisIdempotencyManager implements IdempotencyManager {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyManager.class);

    /** SET NX 失败后读取记录时，记录恰好过期的重试次数 */
    private static final int MAX_CLAIM_ATTEMPTS = 3;

    private final RedisClient redisClient;
    private final IdempotencyConfig config;
    private final GuardMetricsRecorder metricsRecorder;
    private final ObjectMapper objectMapper = JsonSupport.create();

    public RedisIdempotencyManager(RedisClient redisClient) {
        this(redisClient, IdempotencyConfig.defaults(), GuardMetricsRecorder.noop());
    }

    public RedisIdempotencyManager(RedisClient redisClient, IdempotencyConfig config,
                                   GuardMetricsRecorder metricsRecorder) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient");
        this.config = Objects.requireNonNull(config, "config");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    @Override
    public String generateContentHash(Object content) {
        return ContentHasher.hash(content);
    }

    @Override
    public IdempotencyCheck checkAndSet(String key, Object result, Duration ttl) {
        String fullKey = config.idempotencyKey(key);
        IdempotencyRecord fresh = result != null ? IdempotencyRecord.complete(result) : IdempotencyRecord.processing();
        String json = JsonSupport.write(objectMapper, fresh);
        Duration effectiveTtl = ttl != null ? ttl : config.getDefaultTtl();

        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            if (redisClient.setIfAbsent(fullKey, json, effectiveTtl)) {
                return IdempotencyCheck.firstSeen();
            }
            String existing = redisClient.get(fullKey);
            if (existing != null) {
                IdempotencyRecord record = readQuietly(key, existing);
                IdempotencyCheck check = IdempotencyCheck.duplicateOf(record);
                log.debug("Idempotent hit for key: {} (status={})", key, check.status());
                metricsRecorder.onDuplicate(check.status());
                return check;
            }
        }
        // 记录反复在 SET NX 与 GET 之间过期，按“状态未知的重复”处理，不放行执行
        log.warn("Idempotency key {} kept expiring during check, treating as duplicate", key);
        metricsRecorder.onDuplicate(null);
        return IdempotencyCheck.duplicateOf(null);
    }

    @Override
    public void setResult(String key, Object result, Duration ttl) {
        redisClient.setWithTtl(config.idempotencyKey(key),
                JsonSupport.write(objectMapper, IdempotencyRecord.complete(result)),
                ttl != null ? ttl : config.getDefaultTtl());
    }

    @Override
    public void setError(String key, String error, Duration ttl) {
        redisClient.setWithTtl(config.idempotencyKey(key),
                JsonSupport.write(objectMapper, IdempotencyRecord.error(error)),
                ttl != null ? ttl : config.errorTtl());
    }

    @Override
    public ContentCheck shouldProcessContent(Object content, String operation) {
        String contentHash = generateContentHash(content);
        IdempotencyCheck check = checkAndSet(operation + ":" + contentHash);
        if (check.duplicate()) {
            log.debug("Content already processed: {}:{}", operation, contentHash.substring(0, 8));
        }
        return new ContentCheck(!check.duplicate(), contentHash);
    }

    @Override
    public Optional<IdempotencyStatus> getStatus(String key) {
        String existing = redisClient.get(config.idempotencyKey(key));
        if (existing == null) {
            return Optional.empty();
        }
        IdempotencyRecord record = readQuietly(key, existing);
        return record == null ? Optional.empty() : Optional.ofNullable(record.status());
    }

    @Override
    public boolean invalidate(String key) {
        return redisClient.delete(config.idempotencyKey(key));
    }

    public IdempotencyConfig getConfig() {
        return config;
    }

    private IdempotencyRecord readQuietly(String key, String json) {
        try {
            return JsonSupport.read(objectMapper, json, IdempotencyRecord.class);
        } catch (GuardSerializationException e) {
            log.warn("Unreadable idempotency record for key {}", key);
            return null;
        }
    }
}
