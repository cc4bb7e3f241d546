package xyz.firestige.redis.guard.spring.lifecycle;

import org.springframework.context.SmartLifecycle;
import xyz.firestige.redis.guard.dlq.RetryProcessor;

/**
 * 让重试处理器随应用上下文启动和关闭
 */
public class RetryProcessorLifecycle implements SmartLifecycle {

    private final RetryProcessor retryProcessor;

    public RetryProcessorLifecycle(RetryProcessor retryProcessor) {
        this.retryProcessor = retryProcessor;
    }

    @Override
    public void start() {
        retryProcessor.start();
    }

    @Override
    public void stop() {
        retryProcessor.stop();
    }

    @Override
    public boolean isRunning() {
        return retryProcessor.isRunning();
    }
}
