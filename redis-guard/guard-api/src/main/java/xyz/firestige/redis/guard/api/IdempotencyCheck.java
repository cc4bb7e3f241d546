package xyz.firestige.redis.guard.api;

/**
 * check-and-set 的结果
 *
 * @param duplicate Key 是否已存在
 * @param status 已存在记录的状态；首次出现或记录无法解析时为 null
 * @param cachedResult 已完成记录的结果，其余情况为 null
 * @since 1.0
 */
public record IdempotencyCheck(boolean duplicate, IdempotencyStatus status, Object cachedResult) {

    private static final IdempotencyCheck FIRST_SEEN = new IdempotencyCheck(false, null, null);

    public static IdempotencyCheck firstSeen() {
        return FIRST_SEEN;
    }

    public static IdempotencyCheck duplicateOf(IdempotencyRecord record) {
        if (record == null) {
            return new IdempotencyCheck(true, null, null);
        }
        Object result = record.status() == IdempotencyStatus.COMPLETE ? record.result() : null;
        return new IdempotencyCheck(true, record.status(), result);
    }
}
