package xyz.firestige.redis.guard.dlq;

/**
 * 一轮重试处理的结果
 *
 * @param claimed 本轮领取的任务数
 * @param succeeded 处理成功的任务数
 * @param failed 处理失败并重新上报的任务数
 * @param missingHandler 因没有处理器而直接进入死信的任务数
 */
public record RetryBatchResult(int claimed, int succeeded, int failed, int missingHandler) {

    public static RetryBatchResult empty() {
        return new RetryBatchResult(0, 0, 0, 0);
    }
}
