package xyz.firestige.redis.guard.api;

import java.util.Map;

/**
 * 任务处理器，由重试处理器按任务名查找后以存储的参数调用
 *
 * <p>正常返回视为成功；抛出任何异常视为本次重试失败。
 *
 * @since 1.0
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * @param args 任务首次失败时存储的参数
     * @throws Exception 处理失败
     */
    void handle(Map<String, Object> args) throws Exception;
}
