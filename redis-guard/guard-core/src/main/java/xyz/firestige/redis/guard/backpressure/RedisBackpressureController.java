package xyz.firestige.redis.guard.backpressure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.redis.guard.api.BackpressureController;
import xyz.firestige.redis.guard.api.GuardMetricsRecorder;
import xyz.firestige.redis.guard.api.RedisClient;
import xyz.firestige.redis.guard.exception.BackpressureTimeoutException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Redis 队列长度的背压控制器
 *
 * <p>压力 = 队列长度 / 阈值。两级信号：
 * <ul>
 *   <li>{@link #checkBackpressure} 压力 &gt; 1.0，生产者应暂停</li>
 *   <li>{@link #shouldThrottle} 压力 &gt;= 节流阈值（默认 0.7），生产者应降速</li>
 * </ul>
 *
 * <pre>{@code
 * if (controller.checkBackpressure("ai_processor_queue")) {
 *     controller.waitForCapacity("ai_processor_queue");
 * }
 * submit(task);
 * }</pre>
 *
 * @since 1.0
 */
public class RedisBackpressureController implements BackpressureController {

    private static final Logger log = LoggerFactory.getLogger(RedisBackpressureController.class);

    private static final double THROTTLE_START = 0.5;

    private final RedisClient redisClient;
    private final BackpressureConfig config;
    private final Sleeper sleeper;
    private final GuardMetricsRecorder metricsRecorder;
    private final Map<String, Integer> thresholds = new ConcurrentHashMap<>();

    public RedisBackpressureController(RedisClient redisClient) {
        this(redisClient, BackpressureConfig.defaults(), Sleeper.threadSleep(), GuardMetricsRecorder.noop());
    }

    public RedisBackpressureController(RedisClient redisClient, BackpressureConfig config, Sleeper sleeper,
                                       GuardMetricsRecorder metricsRecorder) {
        this.redisClient = Objects.requireNonNull(redisClient, "redisClient");
        this.config = Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metricsRecorder = metricsRecorder != null ? metricsRecorder : GuardMetricsRecorder.noop();
        this.thresholds.putAll(config.getThresholds());
        this.thresholds.putIfAbsent(DEFAULT_QUEUE, config.getDefaultThreshold());
    }

    @Override
    public void setThreshold(String queueName, int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, got " + threshold);
        }
        thresholds.put(queueName, threshold);
        log.debug("Set backpressure threshold for {}: {}", queueName, threshold);
    }

    @Override
    public int getThreshold(String queueName) {
        Integer threshold = thresholds.get(queueName);
        return threshold != null ? threshold : thresholds.get(DEFAULT_QUEUE);
    }

    @Override
    public long getQueueLength(String queueName) {
        for (String pattern : config.getKeyPatterns()) {
            long length = redisClient.llen(pattern.replace(BackpressureConfig.QUEUE_PLACEHOLDER, queueName));
            if (length > 0) {
                return length;
            }
        }
        return 0L;
    }

    @Override
    public double getPressureLevel(String queueName) {
        int threshold = getThreshold(queueName);
        if (threshold <= 0) {
            return 0.0;
        }
        return (double) getQueueLength(queueName) / threshold;
    }

    @Override
    public boolean checkBackpressure(String queueName) {
        int threshold = getThreshold(queueName);
        long length = getQueueLength(queueName);
        if (threshold > 0 && length > threshold) {
            log.warn("Backpressure triggered for {}: {}/{} items (threshold exceeded)", queueName, length, threshold);
            return true;
        }
        return false;
    }

    @Override
    public boolean shouldThrottle(String queueName, double throttleThreshold) {
        return getPressureLevel(queueName) >= throttleThreshold;
    }

    @Override
    public Duration getRecommendedDelay(String queueName, Duration baseDelay, Duration maxDelay) {
        double pressure = getPressureLevel(queueName);
        if (pressure < THROTTLE_START) {
            return baseDelay;
        }
        double factor = Math.min(1.0, (pressure - THROTTLE_START) / THROTTLE_START);
        long baseNanos = baseDelay.toNanos();
        long extra = Math.round((maxDelay.toNanos() - baseNanos) * factor);
        return Duration.ofNanos(baseNanos + extra);
    }

    @Override
    public Duration waitForCapacity(String queueName) throws InterruptedException {
        return waitForCapacity(queueName, config.getCheckInterval(), config.getMaxWait(), config.getTargetPressure());
    }

    @Override
    public Duration waitForCapacity(String queueName, Duration checkInterval, Duration maxWait,
                                    double targetPressure) throws InterruptedException {
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive, got " + checkInterval);
        }
        Duration waited = Duration.ZERO;
        while (true) {
            double pressure = getPressureLevel(queueName);
            if (pressure < targetPressure) {
                if (!waited.isZero()) {
                    log.info("Backpressure relieved for {} (pressure: {}, waited: {}s)",
                            queueName, percent(pressure), waited.toSeconds());
                    metricsRecorder.onBackpressureWait(queueName, waited, false);
                }
                return waited;
            }
            if (waited.compareTo(maxWait) >= 0) {
                log.error("Backpressure timeout for {}: waited {}s, pressure still at {}",
                        queueName, waited.toSeconds(), percent(pressure));
                metricsRecorder.onBackpressureWait(queueName, waited, true);
                throw new BackpressureTimeoutException(queueName, waited, pressure);
            }
            log.info("Waiting for {} capacity... (pressure: {}, waited: {}s)",
                    queueName, percent(pressure), waited.toSeconds());
            sleeper.sleep(checkInterval);
            waited = waited.plus(checkInterval);
        }
    }

    @Override
    public Map<String, Double> getAllPressures() {
        Map<String, Double> pressures = new LinkedHashMap<>();
        for (String queueName : new TreeMap<>(thresholds).keySet()) {
            if (!DEFAULT_QUEUE.equals(queueName)) {
                pressures.put(queueName, getPressureLevel(queueName));
            }
        }
        return pressures;
    }

    private static String percent(double pressure) {
        return String.format("%.1f%%", pressure * 100);
    }
}
