package xyz.firestige.redis.guard.backpressure;

import xyz.firestige.redis.guard.api.BackpressureController;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 先等待队列容量再执行调用
 *
 * <pre>{@code
 * BackpressureGate gate = new BackpressureGate(controller, "ai_processor_queue", Duration.ofSeconds(60));
 * gate.execute(() -> queue.submit(task));
 * }</pre>
 */
public class BackpressureGate {

    private final BackpressureController controller;
    private final String queueName;
    private final Duration checkInterval;
    private final Duration maxWait;
    private final double targetPressure;

    public BackpressureGate(BackpressureController controller, String queueName, Duration maxWait) {
        this(controller, queueName, BackpressureConfig.DEFAULT_CHECK_INTERVAL, maxWait,
                BackpressureController.DEFAULT_TARGET_PRESSURE);
    }

    public BackpressureGate(BackpressureController controller, String queueName, Duration checkInterval,
                            Duration maxWait, double targetPressure) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
        this.targetPressure = targetPressure;
    }

    /**
     * @throws xyz.firestige.redis.guard.exception.BackpressureTimeoutException 等待超时，调用不会执行
     * @throws InterruptedException 等待期间线程被中断
     */
    public <T> T execute(Callable<T> call) throws Exception {
        controller.waitForCapacity(queueName, checkInterval, maxWait, targetPressure);
        return call.call();
    }

    public String getQueueName() {
        return queueName;
    }
}
