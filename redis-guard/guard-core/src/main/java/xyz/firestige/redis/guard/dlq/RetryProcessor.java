package xyz.firestige.redis.guard.dlq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.redis.guard.api.DeadLetterQueue;
import xyz.firestige.redis.guard.api.FailedTask;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.TaskHandler;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 死信队列重试处理器
 *
 * <p>按固定间隔领取到期的待重试任务，按任务名查找处理器并执行：
 * <ul>
 *   <li>成功：任务丢弃</li>
 *   <li>失败：以 retryCount + 1 重新上报，由死信队列决定再次退避还是归档</li>
 *   <li>没有处理器：直接归档为死信，不再重试</li>
 * </ul>
 *
 * <p>处理器抛出的任何异常（含 Error）都按一次失败处理；单轮出现的其它异常只记录日志，下一轮照常执行。
 *
 * @since 1.0
 */
public class RetryProcessor {

    private static final Logger log = LoggerFactory.getLogger(RetryProcessor.class);

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final String MDC_TASK_ID = "dlqTaskId";
    static final String THREAD_NAME = "dlq-retry-processor";

    private final DeadLetterQueue deadLetterQueue;
    private final TaskHandlerRegistry handlers;
    private final Duration checkInterval;
    private final int batchSize;
    private final GuardMetricsRecorder metricsRecorder;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private volatile boolean running;

    public RetryProcessor(DeadLetterQueue deadLetterQueue, TaskHandlerRegistry handlers) {
        this(deadLetterQueue, handlers, DEFAULT_CHECK_INTERVAL, DEFAULT_BATCH_SIZE, GuardMetricsRecorder.noop());
    }

    public RetryProcessor(DeadLetterQueue deadLetterQueue, TaskHandlerRegistry handlers,
                          Duration checkInterval, int batchSize, GuardMetricsRecorder metricsRecorder) {
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "deadLetterQueue");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive, got " + checkInterval);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        this.batchSize = batchSize;
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        running = true;
        future = scheduler.scheduleWithFixedDelay(this::tick, 0, checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("DLQ Retry Processor started (interval={}s, batchSize={})", checkInterval.toSeconds(), batchSize);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("DLQ Retry Processor stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 执行一轮重试
     *
     * @return 本轮统计
     */
    public RetryBatchResult processOnce() {
        List<FailedTask> tasks = deadLetterQueue.getPendingRetries(batchSize);
        if (tasks.isEmpty()) {
            return RetryBatchResult.empty();
        }
        int succeeded = 0;
        int failed = 0;
        int missingHandler = 0;
        // 任务已从计划中领取，单个任务出错不能影响同批其余任务
        for (FailedTask task : tasks) {
            MDC.put(MDC_TASK_ID, task.getId());
            try {
                switch (retry(task)) {
                    case SUCCEEDED -> succeeded++;
                    case FAILED -> failed++;
                    case NO_HANDLER -> missingHandler++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to re-report claimed task {} ({})", task.getId(), task.getTaskName(), e);
                failed++;
            } finally {
                MDC.remove(MDC_TASK_ID);
            }
        }
        return new RetryBatchResult(tasks.size(), succeeded, failed, missingHandler);
    }

    private Outcome retry(FailedTask task) {
        String taskName = task.getTaskName();
        Optional<TaskHandler> handler = handlers.find(taskName);
        if (handler.isEmpty()) {
            log.error("No handler for task: {}", taskName);
            deadLetterQueue.addFailedTask(taskName, task.getArgs(),
                    "No handler registered for task: " + taskName,
                    deadLetterQueue.getMaxRetries(), task.getId(), task.getMetadata());
            return Outcome.NO_HANDLER;
        }

        try {
            log.info("Retrying task {} (attempt {})", taskName, task.getRetryCount() + 1);
            handler.get().handle(task.getArgs());
            log.info("Task {} succeeded on retry", taskName);
            metricsRecorder.onRetryOutcome(taskName, true);
            return Outcome.SUCCEEDED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reportFailure(task, e);
            return Outcome.FAILED;
        } catch (Exception | Error e) {
            reportFailure(task, e);
            return Outcome.FAILED;
        }
    }

    private void reportFailure(FailedTask task, Throwable e) {
        log.warn("Task {} failed on retry: {}", task.getTaskName(), e.toString());
        metricsRecorder.onRetryOutcome(task.getTaskName(), false);
        deadLetterQueue.addFailedTask(task.getTaskName(), task.getArgs(), errorText(e),
                task.getRetryCount() + 1, task.getId(), task.getMetadata());
    }

    static String errorText(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private void tick() {
        if (!running) {
            return;
        }
        // 异常逃出 tick 会让调度器静默停止
        try {
            processOnce();
        } catch (Exception | Error e) {
            log.error("Error in DLQ retry processor", e);
        }
    }

    private enum Outcome {
        SUCCEEDED, FAILED, NO_HANDLER
    }
}
