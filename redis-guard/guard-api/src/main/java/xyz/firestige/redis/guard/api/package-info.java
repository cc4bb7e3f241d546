/**
 * redis-guard 核心 API
 * <p>
 * 定义熔断、死信重试、背压、幂等四个组件的契约与数据模型，不包含任何实现。
 * <p>
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.redis.guard.api.RedisClient} - 存储抽象</li>
 *   <li>{@link xyz.firestige.redis.guard.api.CircuitBreaker} - 进程内熔断器</li>
 *   <li>{@link xyz.firestige.redis.guard.api.DeadLetterQueue} - 退避重试与死信归档</li>
 *   <li>{@link xyz.firestige.redis.guard.api.BackpressureController} - 基于队列深度的背压</li>
 *   <li>{@link xyz.firestige.redis.guard.api.IdempotencyManager} - 按键或内容哈希去重</li>
 *   <li>{@link xyz.firestige.redis.guard.api.TaskHandler} - 重试处理器调用的任务处理器</li>
 *   <li>{@link xyz.firestige.redis.guard.api.GuardMetricsRecorder} - 指标记录器接口</li>
 * </ul>
 * <p>
 * 数据模型：
 * <ul>
 *   <li>{@link xyz.firestige.redis.guard.api.CircuitBreakerSnapshot} - 熔断器状态快照</li>
 *   <li>{@link xyz.firestige.redis.guard.api.FailedTask} - 失败任务</li>
 *   <li>{@link xyz.firestige.redis.guard.api.DeadLetterStats} - 死信统计</li>
 *   <li>{@link xyz.firestige.redis.guard.api.IdempotencyRecord} - 幂等记录</li>
 *   <li>{@link xyz.firestige.redis.guard.api.IdempotencyCheck} - check-and-set 结果</li>
 * </ul>
 *
 * @since 1.0
 */
package xyz.firestige.redis.guard.api;
