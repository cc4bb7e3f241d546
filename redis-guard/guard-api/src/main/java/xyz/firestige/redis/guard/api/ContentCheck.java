package xyz.firestige.redis.guard.api;

/**
 * 内容去重判断结果
 *
 * @param shouldProcess 内容是否需要处理（首次出现）
 * @param contentHash 内容哈希
 * @since 1.0
 */
public record ContentCheck(boolean shouldProcess, String contentHash) {
}
