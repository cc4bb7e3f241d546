package xyz.firestige.redis.guard.backpressure;

import java.time.Duration;

/**
 * 等待容量时的休眠抽象，测试中替换为不真正休眠的实现
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
