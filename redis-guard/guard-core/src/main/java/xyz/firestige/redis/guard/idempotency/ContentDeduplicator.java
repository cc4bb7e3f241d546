package xyz.firestige.redis.guard.idempotency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.ContentCheck;
import xyz.firestige.redis.guard.api.RedisClient;

import java.util.Objects;

/**
 * 内容去重
 *
 * <p>在 {@code <prefix>:dedup:<namespace>:<hash>} 下写入“已见过”标记（默认保留 7 天），
 * 用于跳过重复抓取或重复生成的内容。
 */
public class ContentDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(ContentDeduplicator.class);

    private static final String SEEN = "1";

    private final RedisClient redisClient;
    private final IdempotencyConfig config;
    private final String namespace;

    public ContentDeduplicator(RedisClient redisClient, IdempotencyConfig config) {
        this(redisClient, config, config.getDedupNamespace());
    }

    public ContentDeduplicator(RedisClient redisClient, IdempotencyConfig config, String namespace) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient");
        this.config = Objects.requireNonNull(config, "config");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * 首次见到的内容会被原子地标记为已见过
     *
     * @return shouldProcess 为 false 表示重复内容
     */
    public ContentCheck isDuplicate(Object content) {
        String contentHash = ContentHasher.hash(content);
        boolean first = redisClient.setIfAbsent(key(contentHash), SEEN, config.getDedupTtl());
        if (!first) {
            log.debug("Duplicate content in {}: {}", namespace, contentHash);
        }
        return new ContentCheck(first, contentHash);
    }

    public boolean isSeen(String contentHash) {
        return redisClient.exists(key(contentHash));
    }

    public void markSeen(String contentHash) {
        redisClient.setWithTtl(key(contentHash), SEEN, config.getDedupTtl());
    }

    public String getNamespace() {
        return namespace;
    }

    private String key(String contentHash) {
        return config.dedupKey(namespace, contentHash);
    }
}
