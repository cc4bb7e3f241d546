package xyz.firestige.redis.guard.dlq;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.DeadLetterQueue;
import xyz.firestige.redis.guard.api.DeadLetterStats;
import xyz.firestige.redis.guard.api.FailedTask;
import xyz.firestige.redis.guard.api.FailedTaskStatus;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.RedisClient;
import xyz.firestige.redis.guard.exception.GuardSerializationException;
import xyz.firestige.redis.guard.support.JsonSupport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 基于 Redis 的死信队列
 *
 * <h3>Redis 数据结构</h3>
 * <ul>
 *   <li>{@code <prefix>:dlq:retry_queue} - ZSet，member 为任务 JSON，score 为计划重试时间（epoch 秒）</li>
 *   <li>{@code <prefix>:dlq:dead_letters} - List，LPUSH 写入，头部是最新的死信</li>
 *   <li>{@code <prefix>:dlq:stats} - Hash，累计计数器</li>
 * </ul>
 *
 * <p>取出待重试任务与移动死信时，以 ZREM / LREM 的返回值作为认领凭证：
 * 只有真正删除了该条目的调用方才会处理它，因此并发轮询者不会重复领取同一条目。
 *
 * @since 1.0
 */
public class RedisDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisDeadLetterQueue.class);

    static final int MAX_ERROR_LENGTH = 5000;
    private static final int LOG_ERROR_LENGTH = 200;

    static final String STAT_RETRIES_SCHEDULED = "retries_scheduled";
    static final String STAT_DEAD_LETTERS = "dead_letters";
    static final String STAT_MANUAL_RETRIES = "manual_retries";
    static final String STAT_ACKNOWLEDGED = "acknowledged";

    private final RedisClient redisClient;
    private final DeadLetterQueueConfig config;
    private final Clock clock;
    private final GuardMetricsRecorder metricsRecorder;
    private final ObjectMapper objectMapper = JsonSupport.create();

    public RedisDeadLetterQueue(RedisClient redisClient, DeadLetterQueueConfig config) {
        this(redisClient, config, Clock.systemUTC(), GuardMetricsRecorder.noop());
    }

    public RedisDeadLetterQueue(RedisClient redisClient, DeadLetterQueueConfig config, Clock clock,
                                GuardMetricsRecorder metricsRecorder) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    @Override
    public String addFailedTask(String taskName, Map<String, Object> args, String error,
                                int retryCount, String taskId, Map<String, Object> metadata) {
        Objects.requireNonNull(taskName, "taskName");
        String id = taskId != null ? taskId : taskName + ":" + UUID.randomUUID();
        String errorText = truncate(String.valueOf(error), MAX_ERROR_LENGTH);
        Instant now = clock.instant();
        int maxRetries = config.getMaxRetries();

        if (retryCount < maxRetries) {
            FailedTask task = new FailedTask(id, taskName, args, errorText, retryCount, now, metadata,
                    FailedTaskStatus.PENDING_RETRY);
            Duration delay = config.delayFor(retryCount);
            redisClient.zadd(config.retryQueueKey(), JsonSupport.write(objectMapper, task),
                    epochSeconds(now.plus(delay)));
            redisClient.hincrBy(config.statsKey(), STAT_RETRIES_SCHEDULED, 1);
            metricsRecorder.onRetryScheduled(taskName, retryCount);
            log.warn("Task {} (id={}) scheduled for retry #{} in {}s",
                    taskName, id, retryCount + 1, delay.toSeconds());
        } else {
            FailedTask task = new FailedTask(id, taskName, args, errorText, retryCount, now, metadata,
                    FailedTaskStatus.DEAD);
            pushDeadLetter(JsonSupport.write(objectMapper, task));
            redisClient.hincrBy(config.statsKey(), STAT_DEAD_LETTERS, 1);
            metricsRecorder.onDeadLettered(taskName);
            log.error("Task {} (id={}) moved to DLQ after {} failed retries. Error: {}",
                    taskName, id, maxRetries, truncate(errorText, LOG_ERROR_LENGTH));
        }
        return id;
    }

    @Override
    public List<FailedTask> getPendingRetries(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String retryKey = config.retryQueueKey();
        List<String> due = redisClient.zrangeByScore(retryKey, Double.NEGATIVE_INFINITY,
                epochSeconds(clock.instant()), 0, limit);

        List<FailedTask> claimed = new ArrayList<>(due.size());
        for (String json : due) {
            if (redisClient.zrem(retryKey, json) == 0) {
                // 已被其他轮询者领取
                continue;
            }
            try {
                claimed.add(JsonSupport.read(objectMapper, json, FailedTask.class));
            } catch (GuardSerializationException e) {
                // 原样归档，保留给人工排查
                pushDeadLetter(json);
                redisClient.hincrBy(config.statsKey(), STAT_DEAD_LETTERS, 1);
                log.error("Moved unreadable retry entry to dead letters: {}", truncate(json, LOG_ERROR_LENGTH), e);
            }
        }
        if (!claimed.isEmpty()) {
            log.info("Retrieved {} tasks ready for retry", claimed.size());
        }
        return claimed;
    }

    @Override
    public List<FailedTask> getDeadLetters(int limit, String taskName) {
        if (limit <= 0) {
            return List.of();
        }
        List<FailedTask> result = new ArrayList<>();
        List<String> entries = taskName == null
                ? redisClient.lrange(config.deadLettersKey(), 0, limit - 1L)
                : redisClient.lrange(config.deadLettersKey(), 0, -1);
        for (String json : entries) {
            FailedTask task = readQuietly(json);
            if (task == null || (taskName != null && !taskName.equals(task.getTaskName()))) {
                continue;
            }
            result.add(task);
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    @Override
    public boolean retryDeadLetter(String taskId) {
        String deadKey = config.deadLettersKey();
        for (String json : redisClient.lrange(deadKey, 0, -1)) {
            FailedTask task = readQuietly(json);
            if (task == null || !Objects.equals(task.getId(), taskId)) {
                continue;
            }
            if (redisClient.lrem(deadKey, 1, json) == 0) {
                break;
            }
            Instant now = clock.instant();
            task.setRetryCount(0);
            task.setStatus(FailedTaskStatus.PENDING_RETRY);
            task.setManuallyRetriedAt(now);
            redisClient.zadd(config.retryQueueKey(), JsonSupport.write(objectMapper, task), epochSeconds(now));
            redisClient.hincrBy(config.statsKey(), STAT_MANUAL_RETRIES, 1);
            log.info("Dead letter task {} queued for retry", taskId);
            return true;
        }
        log.warn("Dead letter task {} not found", taskId);
        return false;
    }

    @Override
    public boolean deleteDeadLetter(String taskId) {
        String deadKey = config.deadLettersKey();
        for (String json : redisClient.lrange(deadKey, 0, -1)) {
            FailedTask task = readQuietly(json);
            if (task == null || !Objects.equals(task.getId(), taskId)) {
                continue;
            }
            if (redisClient.lrem(deadKey, 1, json) == 0) {
                break;
            }
            redisClient.hincrBy(config.statsKey(), STAT_ACKNOWLEDGED, 1);
            log.info("Dead letter task {} acknowledged and removed", taskId);
            return true;
        }
        return false;
    }

    @Override
    public int cleanupOldDeadLetters() {
        String deadKey = config.deadLettersKey();
        Instant cutoff = clock.instant().minus(config.getRetention());
        int removed = 0;
        for (String json : redisClient.lrange(deadKey, 0, -1)) {
            FailedTask task = readQuietly(json);
            if (task == null || task.getFailedAt() == null || !task.getFailedAt().isBefore(cutoff)) {
                continue;
            }
            removed += (int) redisClient.lrem(deadKey, 1, json);
        }
        if (removed > 0) {
            log.info("Cleaned up {} old dead letters", removed);
        }
        return removed;
    }

    @Override
    public DeadLetterStats getStats() {
        Map<String, String> counters = redisClient.hgetAll(config.statsKey());
        return new DeadLetterStats(
                redisClient.llen(config.deadLettersKey()),
                redisClient.zcard(config.retryQueueKey()),
                counter(counters, STAT_RETRIES_SCHEDULED),
                counter(counters, STAT_DEAD_LETTERS),
                counter(counters, STAT_MANUAL_RETRIES),
                counter(counters, STAT_ACKNOWLEDGED));
    }

    @Override
    public int getMaxRetries() {
        return config.getMaxRetries();
    }

    public DeadLetterQueueConfig getConfig() {
        return config;
    }

    private void pushDeadLetter(String json) {
        String deadKey = config.deadLettersKey();
        redisClient.lpush(deadKey, json);
        int cap = config.getMaxDeadLetters();
        if (cap > 0 && redisClient.llen(deadKey) > cap) {
            redisClient.ltrim(deadKey, 0, cap - 1L);
            log.warn("Dead letter archive exceeded {} entries, oldest entries dropped", cap);
        }
    }

    private FailedTask readQuietly(String json) {
        try {
            return JsonSupport.read(objectMapper, json, FailedTask.class);
        } catch (GuardSerializationException e) {
            log.warn("Skipping unreadable dead letter entry: {}", truncate(json, LOG_ERROR_LENGTH));
            return null;
        }
    }

    private static long counter(Map<String, String> counters, String name) {
        String value = counters.get(name);
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric DLQ counter {}={}", name, value);
            return 0L;
        }
    }

    private static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
