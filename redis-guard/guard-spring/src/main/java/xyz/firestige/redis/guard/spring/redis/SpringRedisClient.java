package xyz.firestige.redis.guard.spring.redis;

import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.guard.api.RedisClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 Spring StringRedisTemplate 的 RedisClient 实现
 *
 * <p>模板返回 null（事务或管道中）时按“未命中”处理。
 *
 * @since 1.0
 */
public class SpringRedisClient implements RedisClient {

    private final StringRedisTemplate redisTemplate;

    public SpringRedisClient(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
    }

    @Override
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        if (ttl == null) {
            redisTemplate.opsForValue().set(key, value);
        } else {
            redisTemplate.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean set = ttl == null
                ? redisTemplate.opsForValue().setIfAbsent(key, value)
                : redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
        return Boolean.TRUE.equals(set);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    @Override
    public long hincrBy(String key, String field, long delta) {
        Long value = redisTemplate.opsForHash().increment(key, field, delta);
        return value != null ? value : 0L;
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
        Map<String, String> result = new LinkedHashMap<>();
        entries.forEach((field, value) -> result.put(String.valueOf(field), String.valueOf(value)));
        return result;
    }

    @Override
    public void lpush(String key, String value) {
        redisTemplate.opsForList().leftPush(key, value);
    }

    @Override
    public List<String> lrange(String key, long start, long stop) {
        List<String> values = redisTemplate.opsForList().range(key, start, stop);
        return values != null ? values : List.of();
    }

    @Override
    public long llen(String key) {
        Long size = redisTemplate.opsForList().size(key);
        return size != null ? size : 0L;
    }

    @Override
    public long lrem(String key, long count, String value) {
        Long removed = redisTemplate.opsForList().remove(key, count, value);
        return removed != null ? removed : 0L;
    }

    @Override
    public void ltrim(String key, long start, long stop) {
        redisTemplate.opsForList().trim(key, start, stop);
    }

    @Override
    public void zadd(String key, String member, double score) {
        redisTemplate.opsForZSet().add(key, member, score);
    }

    @Override
    public List<String> zrangeByScore(String key, double min, double max, long offset, long count) {
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(key, min, max, offset, count);
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public long zrem(String key, String member) {
        Long removed = redisTemplate.opsForZSet().remove(key, member);
        return removed != null ? removed : 0L;
    }

    @Override
    public long zcard(String key) {
        Long size = redisTemplate.opsForZSet().zCard(key);
        return size != null ? size : 0L;
    }
}
