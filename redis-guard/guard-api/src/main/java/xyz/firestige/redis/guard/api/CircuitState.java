package xyz.firestige.redis.guard.api;

/**
 * 熔断器状态
 *
 * <pre>
 * CLOSED --[失败数 >= 阈值]--> OPEN
 * OPEN --[距上次失败 >= 恢复超时, 被探测]--> HALF_OPEN
 * HALF_OPEN --[成功数 >= 探测上限]--> CLOSED
 * HALF_OPEN --[任意失败]--> OPEN
 * </pre>
 *
 * @since 1.0
 */
public enum CircuitState {

    /** 正常放行 */
    CLOSED("closed"),

    /** 快速失败，拒绝调用 */
    OPEN("open"),

    /** 放行有限次数的探测调用 */
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
