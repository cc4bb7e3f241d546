package xyz.firestige.redis.guard.api;

import java.util.List;
import java.util.Map;

/**
 * 死信队列
 *
 * <p>把暂时性失败转成按退避计划执行的重试，把持续失败转成可查看、可重放的死信归档。
 *
 * <p>流程：任务失败 → 按退避延迟重试（最多 maxRetries 次）→ 死信归档 → 人工重试或确认删除
 *
 * <p>到期重试的读取保证是 at-least-once：跨进程的多个轮询方不会对同一条目重复认领，
 * 但认领后进程崩溃会丢失该次尝试。
 *
 * @since 1.0
 */
public interface DeadLetterQueue {

    /**
     * 首次上报失败（retryCount = 0）
     *
     * @return 任务 ID
     */
    default String addFailedTask(String taskName, Map<String, Object> args, String error) {
        return addFailedTask(taskName, args, error, 0, null, null);
    }

    /**
     * 以异常上报首次失败
     *
     * @return 任务 ID
     */
    default String addFailedTask(String taskName, Map<String, Object> args, Throwable error) {
        return addFailedTask(taskName, args, String.valueOf(error), 0, null, null);
    }

    /**
     * 上报失败任务
     *
     * <p>retryCount 小于最大重试次数时按 retryDelays[min(retryCount, len - 1)] 安排重试，
     * 否则追加到死信归档。
     *
     * @param taskName 任务名
     * @param args 任务参数（重试时原样传给处理器）
     * @param error 错误描述，超长时截断
     * @param retryCount 已重试次数，0 表示首次失败
     * @param taskId 任务 ID，为 null 时自动生成
     * @param metadata 附加信息，可为 null
     * @return 任务 ID
     */
    String addFailedTask(String taskName, Map<String, Object> args, String error,
                         int retryCount, String taskId, Map<String, Object> metadata);

    /**
     * 取出并移除已到期（retryAt <= now）的重试任务
     *
     * @param limit 最多返回条数
     * @return 已认领的任务
     */
    List<FailedTask> getPendingRetries(int limit);

    /**
     * 查询死信（最新的在前）
     *
     * @param limit 最多返回条数
     * @param taskName 按任务名过滤，为 null 时不过滤
     * @return 死信列表
     */
    List<FailedTask> getDeadLetters(int limit, String taskName);

    /**
     * 人工重试死信：重置 retryCount 并立即放回重试计划
     *
     * @param taskId 任务 ID
     * @return 找到并重新入队返回 true；未找到返回 false 且不做任何修改
     */
    boolean retryDeadLetter(String taskId);

    /**
     * 确认并永久删除死信
     *
     * @param taskId 任务 ID
     * @return 找到并删除返回 true
     */
    boolean deleteDeadLetter(String taskId);

    /**
     * 清理超过保留期的死信
     *
     * @return 清理条数
     */
    int cleanupOldDeadLetters();

    /**
     * @return 统计信息
     */
    DeadLetterStats getStats();

    /**
     * @return 最大重试次数
     */
    int getMaxRetries();
}
