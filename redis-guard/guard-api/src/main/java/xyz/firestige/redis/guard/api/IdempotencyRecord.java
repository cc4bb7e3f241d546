package xyz.firestige.redis.guard.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 幂等记录的存储形态，TTL 由存储层维护
 *
 * @param status 状态
 * @param result 执行结果（COMPLETE 时有值）
 * @param error 错误信息（ERROR 时有值）
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdempotencyRecord(IdempotencyStatus status, Object result, String error) {

    public static IdempotencyRecord processing() {
        return new IdempotencyRecord(IdempotencyStatus.PROCESSING, null, null);
    }

    public static IdempotencyRecord complete(Object result) {
        return new IdempotencyRecord(IdempotencyStatus.COMPLETE, result, null);
    }

    public static IdempotencyRecord error(String error) {
        return new IdempotencyRecord(IdempotencyStatus.ERROR, null, error);
    }
}
