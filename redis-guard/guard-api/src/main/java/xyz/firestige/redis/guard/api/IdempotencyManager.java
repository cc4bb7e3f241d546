package xyz.firestige.redis.guard.api;

import java.time.Duration;
import java.util.Optional;

/**
 * 幂等管理器
 *
 * <p>保证相同、重试或重复的操作最多产生一次副作用，重复调用方看到一致的结果。
 *
 * <pre>{@code
 * IdempotencyCheck check = manager.checkAndSet("order:123");
 * if (check.duplicate()) {
 *     return check.cachedResult();
 * }
 * Object result = processOrder();
 * manager.setResult("order:123", result);
 * }</pre>
 *
 * @since 1.0
 */
public interface IdempotencyManager {

    /** 内容去重未指定操作名时使用的命名空间 */
    String DEFAULT_OPERATION = "default";

    /**
     * 生成内容哈希：结构化内容先规范化（键排序），再做 SHA-256 并截断
     *
     * @param content 任意可 JSON 化的内容
     * @return 16 位十六进制哈希
     */
    String generateContentHash(Object content);

    default IdempotencyCheck checkAndSet(String key) {
        return checkAndSet(key, null, null);
    }

    /**
     * 原子地检查 Key：存在则返回重复及缓存结果；不存在则写入新记录
     * （提供了 result 时为 COMPLETE，否则为 PROCESSING）
     *
     * @param key 幂等键
     * @param result 立即存储的结果，可为 null
     * @param ttl TTL，为 null 时使用默认值
     * @return 检查结果
     */
    IdempotencyCheck checkAndSet(String key, Object result, Duration ttl);

    default void setResult(String key, Object result) {
        setResult(key, result, null);
    }

    /**
     * 将记录置为 COMPLETE
     */
    void setResult(String key, Object result, Duration ttl);

    default void setError(String key, String error) {
        setError(key, error, null);
    }

    /**
     * 将记录置为 ERROR，默认 TTL 远短于成功记录，使失败的尝试很快可以重试
     */
    void setError(String key, String error, Duration ttl);

    default ContentCheck shouldProcessContent(Object content) {
        return shouldProcessContent(content, DEFAULT_OPERATION);
    }

    /**
     * 以 operation + 内容哈希为键判断内容是否已处理过
     */
    ContentCheck shouldProcessContent(Object content, String operation);

    /**
     * @return 记录状态，记录不存在或无法解析时为空
     */
    Optional<IdempotencyStatus> getStatus(String key);

    /**
     * @return Key 存在并被删除返回 true
     */
    boolean invalidate(String key);
}
