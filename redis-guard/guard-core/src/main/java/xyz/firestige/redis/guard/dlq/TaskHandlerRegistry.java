package xyz.firestige.redis.guard.dlq;

import xyz.firestige.redis.guard.api.NamedTaskHandler;
import xyz.firestige.redis.guard.api.TaskHandler;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 任务名到重试处理器的映射，由应用注册
 */
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public TaskHandlerRegistry register(String taskName, TaskHandler handler) {
        handlers.put(Objects.requireNonNull(taskName, "taskName"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public TaskHandlerRegistry register(NamedTaskHandler handler) {
        return register(handler.getTaskName(), handler);
    }

    public Optional<TaskHandler> find(String taskName) {
        return taskName == null ? Optional.empty() : Optional.ofNullable(handlers.get(taskName));
    }

    public Set<String> getTaskNames() {
        return new TreeSet<>(handlers.keySet());
    }
}
