package xyz.firestige.redis.guard.api;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Redis 客户端抽象接口
 *
 * <p>定义熔断、死信、背压、幂等组件所需的最小操作集，核心逻辑不依赖具体客户端。
 * 所有值均为字符串（JSON 文本或数字文本），不传输二进制负载。
 *
 * <h3>数据类型</h3>
 * <ul>
 *   <li>String：幂等记录、内容去重标记</li>
 *   <li>Hash：死信统计计数器</li>
 *   <li>List：死信归档、被监控的任务队列</li>
 *   <li>ZSet：按重试时间排序的待重试任务（score = epoch 秒）</li>
 * </ul>
 *
 * <h3>实现</h3>
 * <ul>
 *   <li>{@code SpringRedisClient} - 基于 Spring Data Redis (StringRedisTemplate)</li>
 *   <li>{@code InMemoryRedisClient} - 进程内实现，用于单机部署和测试</li>
 * </ul>
 *
 * <p>任何方法都可能阻塞在网络 IO 上；存储不可用时抛出客户端自身的异常，调用方不应吞掉。
 *
 * @since 1.0
 */
public interface RedisClient {

    // ========== String ==========

    /**
     * GET 操作
     *
     * @param key Redis Key
     * @return 值，不存在时返回 null
     */
    String get(String key);

    /**
     * SET 操作 - 设置值并指定 TTL
     *
     * @param key Redis Key
     * @param value 值
     * @param ttl 过期时间
     */
    void setWithTtl(String key, String value, Duration ttl);

    /**
     * SET NX 操作 - 仅当 Key 不存在时写入（原子操作）
     *
     * <p>幂等管理器以此实现原子的 check-then-set。
     *
     * @param key Redis Key
     * @param value 值
     * @param ttl 过期时间
     * @return 写入成功返回 true，Key 已存在返回 false
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * DEL 操作
     *
     * @param key Redis Key
     * @return Key 存在并被删除返回 true
     */
    boolean delete(String key);

    /**
     * EXISTS 操作
     *
     * @param key Redis Key
     * @return Key 是否存在
     */
    boolean exists(String key);

    // ========== Hash ==========

    /**
     * HINCRBY 操作 - 对 Hash 字段做整数累加
     *
     * @param key Redis Hash Key
     * @param field Hash 字段
     * @param delta 增量
     * @return 累加后的值
     */
    long hincrBy(String key, String field, long delta);

    /**
     * HGETALL 操作
     *
     * @param key Redis Hash Key
     * @return 全部字段，Key 不存在时返回空 Map
     */
    Map<String, String> hgetAll(String key);

    // ========== List ==========

    /**
     * LPUSH 操作 - 从左侧推入列表
     *
     * @param key Redis List Key
     * @param value 值
     */
    void lpush(String key, String value);

    /**
     * LRANGE 操作，索引语义与 Redis 一致（负数表示从尾部计数，stop 包含在内）
     *
     * @param key Redis List Key
     * @param start 起始索引
     * @param stop 结束索引
     * @return 区间内的元素，Key 不存在时返回空列表
     */
    List<String> lrange(String key, long start, long stop);

    /**
     * LLEN 操作
     *
     * @param key Redis List Key
     * @return 列表长度，Key 不存在时返回 0
     */
    long llen(String key);

    /**
     * LREM 操作 - 删除与 value 相等的元素
     *
     * @param key Redis List Key
     * @param count 大于 0 从头部开始删除 count 个；小于 0 从尾部开始；等于 0 删除全部
     * @param value 值
     * @return 实际删除的元素个数
     */
    long lrem(String key, long count, String value);

    /**
     * LTRIM 操作 - 仅保留区间内的元素
     *
     * @param key Redis List Key
     * @param start 起始索引
     * @param stop 结束索引
     */
    void ltrim(String key, long start, long stop);

    // ========== Sorted Set ==========

    /**
     * ZADD 操作 - 添加有序集合成员
     *
     * @param key Redis ZSet Key
     * @param member 成员
     * @param score 分数
     */
    void zadd(String key, String member, double score);

    /**
     * ZRANGEBYSCORE 操作（闭区间，按分数升序）
     *
     * @param key Redis ZSet Key
     * @param min 最小分数（包含）
     * @param max 最大分数（包含）
     * @param offset 跳过的成员数
     * @param count 最多返回的成员数
     * @return 成员列表
     */
    List<String> zrangeByScore(String key, double min, double max, long offset, long count);

    /**
     * ZREM 操作
     *
     * <p>返回值可用作认领凭证：并发的多个消费者中只有一个能把同一成员删除成功。
     *
     * @param key Redis ZSet Key
     * @param member 成员
     * @return 实际删除的成员个数
     */
    long zrem(String key, String member);

    /**
     * ZCARD 操作
     *
     * @param key Redis ZSet Key
     * @return 成员个数，Key 不存在时返回 0
     */
    long zcard(String key);
}
