package xyz.firestige.redis.guard.api;

/**
 * 死信队列统计
 *
 * @param deadLetterCount 当前死信归档条数
 * @param pendingRetryCount 当前重试计划条数
 * @param totalRetriesScheduled 累计安排的重试次数
 * @param totalDeadLetters 累计进入死信的次数
 * @param totalManualRetries 累计人工重试次数
 * @param totalAcknowledged 累计确认删除的死信数
 * @since 1.0
 */
public record DeadLetterStats(
        long deadLetterCount,
        long pendingRetryCount,
        long totalRetriesScheduled,
        long totalDeadLetters,
        long totalManualRetries,
        long totalAcknowledged) {
}
