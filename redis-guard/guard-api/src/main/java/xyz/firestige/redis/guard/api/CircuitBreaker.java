package xyz.firestige.redis.guard.api;

/**
 * 熔断器接口
 *
 * <p>调用约定：
 * <ol>
 *   <li>先调用 {@link #canExecute()}，返回 false 时走降级逻辑或抛出 CircuitOpenException，不发起调用</li>
 *   <li>调用成功后调用 {@link #recordSuccess()}</li>
 *   <li>被追踪的异常先调用 {@link #recordFailure()}，再把原异常抛给调用方</li>
 *   <li>其余异常（含 Error）调用 {@link #releaseProbe()} 归还名额，再原样抛出</li>
 * </ol>
 * 未被追踪的异常不计入成功或失败。
 *
 * <p>熔断器状态只存在于当前进程内，不在进程间共享。
 *
 * @since 1.0
 */
public interface CircuitBreaker {

    /**
     * @return 熔断器名称
     */
    String getName();

    /**
     * 判断当前调用能否放行
     *
     * <p>OPEN 状态且恢复超时已过时，会顺带迁移到 HALF_OPEN；HALF_OPEN 状态下会占用一次探测名额。
     * 判断与迁移是原子的。
     *
     * @return 是否放行
     */
    boolean canExecute();

    /**
     * 记录一次成功调用
     */
    void recordSuccess();

    /**
     * 记录一次失败调用
     */
    void recordFailure();

    /**
     * 放行的调用结束但没有记录结果时，归还 HALF_OPEN 下占用的探测名额
     *
     * <p>其它状态下为空操作。
     */
    void releaseProbe();

    /**
     * @return 当前状态快照
     */
    CircuitBreakerSnapshot getState();

    /**
     * 强制回到 CLOSED 并清空计数
     */
    void reset();
}
