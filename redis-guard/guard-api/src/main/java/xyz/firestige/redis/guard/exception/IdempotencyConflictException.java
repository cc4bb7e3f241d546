package xyz.firestige.redis.guard.exception;

import xyz.firestige.redis.guard.api.IdempotencyStatus;

/**
 * 幂等执行器拒绝执行
 * <ul>
 *   <li>PROCESSING：相同 Key 的调用正在执行，不排队也不重跑</li>
 *   <li>ERROR：上次执行失败，需要换新 Key 才能重新执行</li>
 *   <li>null：已有记录无法解析</li>
 * </ul>
 *
 * @since 1.0
 */
public class IdempotencyConflictException extends GuardException {

    private final String key;
    private final IdempotencyStatus status;

    public IdempotencyConflictException(String key, IdempotencyStatus status) {
        super(describe(key, status));
        this.key = key;
        this.status = status;
    }

    private static String describe(String key, IdempotencyStatus status) {
        if (status == IdempotencyStatus.PROCESSING) {
            return "Request with idempotency key '" + key + "' is currently being processed";
        }
        if (status == IdempotencyStatus.ERROR) {
            return "Previous request with idempotency key '" + key + "' failed. Retry with a new key to reprocess";
        }
        return "Idempotency record for key '" + key + "' is unreadable";
    }

    public String getKey() {
        return key;
    }

    public IdempotencyStatus getStatus() {
        return status;
    }
}
