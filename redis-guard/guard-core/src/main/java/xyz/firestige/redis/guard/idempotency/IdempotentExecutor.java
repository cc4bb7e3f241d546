package xyz.firestige.redis.guard.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.IdempotencyCheck;
import xyz.firestige.redis.guard.api.IdempotencyManager;
import xyz.firestige.redis.guard.api.IdempotencyStatus;
import xyz.firestige.redis.guard.exception.IdempotencyConflictException;
import xyz.firestige.redis.guard.support.JsonSupport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 按幂等键执行一次调用
 *
 * <ul>
 *   <li>key 为空：直接执行</li>
 *   <li>已完成：返回缓存结果，不再执行</li>
 *   <li>处理中 / 失败 / 记录不可读：抛出 {@link IdempotencyConflictException}</li>
 *   <li>首次出现：执行并保存结果；执行失败时保存错误信息后原样抛出</li>
 * </ul>
 *
 * <p>失败记录的 TTL 较短，到期后同一个 key 可以重新执行；需要立即重试时应换一个新 key。
 */
public class IdempotentExecutor {

    private static final Logger log = LoggerFactory.getLogger(IdempotentExecutor.class);

    private final IdempotencyManager manager;
    private final Duration ttl;
    private final ObjectMapper objectMapper = JsonSupport.create();

    public IdempotentExecutor(IdempotencyManager manager) {
        this(manager, null);
    }

    /**
     * @param ttl 结果保存时长，为 null 时使用管理器的默认值
     */
    public IdempotentExecutor(IdempotencyManager manager, Duration ttl) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.ttl = ttl;
    }

    public <T> T execute(String key, Class<T> resultType, Callable<T> call) throws Exception {
        if (key == null || key.isBlank()) {
            return call.call();
        }

        IdempotencyCheck check = manager.checkAndSet(key, null, ttl);
        if (check.duplicate()) {
            if (check.status() != IdempotencyStatus.COMPLETE) {
                throw new IdempotencyConflictException(key, check.status());
            }
            log.info("Returning cached result for idempotency key: {}", key);
            return check.cachedResult() == null ? null : objectMapper.convertValue(check.cachedResult(), resultType);
        }

        T result;
        try {
            result = call.call();
        } catch (Exception | Error e) {
            // 任何失败都要离开 PROCESSING，否则该键会被阻塞整个成功 TTL
            manager.setError(key, e.getMessage() != null ? e.getMessage() : e.toString(), null);
            throw e;
        }
        manager.setResult(key, result, ttl);
        return result;
    }
}
