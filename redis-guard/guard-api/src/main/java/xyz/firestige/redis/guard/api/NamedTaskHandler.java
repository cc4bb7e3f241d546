package xyz.firestige.redis.guard.api;

/**
 * 自带任务名的处理器，便于以 Bean 形式批量注册
 *
 * @since 1.0
 */
public interface NamedTaskHandler extends TaskHandler {

    /**
     * @return 处理的任务名
     */
    String getTaskName();
}
