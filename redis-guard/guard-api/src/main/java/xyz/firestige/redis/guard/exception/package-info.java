/**
 * redis-guard 异常类型
 * <p>
 * 定义跨层语义异常，供 API 使用者和实现者共同使用。
 * <ul>
 *   <li>{@link xyz.firestige.redis.guard.exception.GuardException} - 基础异常</li>
 *   <li>{@link xyz.firestige.redis.guard.exception.CircuitOpenException} - 熔断拒绝</li>
 *   <li>{@link xyz.firestige.redis.guard.exception.BackpressureTimeoutException} - 等待容量超时</li>
 *   <li>{@link xyz.firestige.redis.guard.exception.IdempotencyConflictException} - 幂等冲突</li>
 *   <li>{@link xyz.firestige.redis.guard.exception.GuardSerializationException} - 记录编解码失败</li>
 * </ul>
 * <p>
 * 存储不可用不在此列：它以客户端自身的异常向上传播。
 *
 * @since 1.0
 */
package xyz.firestige.redis.guard.exception;
