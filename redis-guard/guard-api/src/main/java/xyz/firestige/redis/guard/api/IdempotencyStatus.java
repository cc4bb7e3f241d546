package xyz.firestige.redis.guard.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 幂等记录状态
 *
 * @since 1.0
 */
public enum IdempotencyStatus {

    /** 有调用正在执行 */
    PROCESSING("processing"),

    /** 已完成，结果可直接返回给重复请求 */
    COMPLETE("complete"),

    /** 执行失败，短 TTL 过期后允许重试 */
    ERROR("error");

    private final String value;

    IdempotencyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IdempotencyStatus fromValue(String value) {
        for (IdempotencyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown idempotency status: " + value);
    }
}
