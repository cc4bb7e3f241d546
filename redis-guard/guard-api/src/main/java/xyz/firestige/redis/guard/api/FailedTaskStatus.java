package xyz.firestige.redis.guard.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 失败任务状态
 *
 * @since 1.0
 */
public enum FailedTaskStatus {

    /** 位于重试计划中，等待到期重试 */
    PENDING_RETRY("pending_retry"),

    /** 重试次数耗尽，已进入死信归档 */
    DEAD("dead");

    private final String value;

    FailedTaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FailedTaskStatus fromValue(String value) {
        for (FailedTaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown failed task status: " + value);
    }
}
