package xyz.firestige.redis.guard.store;

import xyz.firestige.redis.guard.api.RedisClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;

/**
 * 进程内 RedisClient 实现
 *
 * <p>只用于显式声明的单进程部署与测试，不能替代共享的 Redis（死信不持久，幂等记录不跨实例）。
 * 所有操作在同一把锁下执行，因此 setIfAbsent / zrem / lrem 与 Redis 一样是原子的。
 * 只有 String 类型支持 TTL，过期在访问时惰性清理。
 */
public class InMemoryRedisClient implements RedisClient {

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE =
            Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey());

    private final Clock clock;
    private final Map<String, ValueEntry> values = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, LinkedList<String>> lists = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();

    public InMemoryRedisClient() {
        this(Clock.systemUTC());
    }

    public InMemoryRedisClient(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ========== String ==========

    @Override
    public synchronized String get(String key) {
        ValueEntry entry = liveValue(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public synchronized void setWithTtl(String key, String value, Duration ttl) {
        values.put(key, new ValueEntry(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (liveValue(key) != null) {
            return false;
        }
        values.put(key, new ValueEntry(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        boolean removed = liveValue(key) != null && values.remove(key) != null;
        removed |= hashes.remove(key) != null;
        removed |= lists.remove(key) != null;
        removed |= sortedSets.remove(key) != null;
        return removed;
    }

    @Override
    public synchronized boolean exists(String key) {
        return liveValue(key) != null
                || hashes.containsKey(key)
                || lists.containsKey(key)
                || sortedSets.containsKey(key);
    }

    // ========== Hash ==========

    @Override
    public synchronized long hincrBy(String key, String field, long delta) {
        Map<String, String> hash = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>());
        long current = hash.containsKey(field) ? Long.parseLong(hash.get(field)) : 0L;
        long next = current + delta;
        hash.put(field, Long.toString(next));
        return next;
    }

    @Override
    public synchronized Map<String, String> hgetAll(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Map.of() : new LinkedHashMap<>(hash);
    }

    // ========== List ==========

    @Override
    public synchronized void lpush(String key, String value) {
        lists.computeIfAbsent(key, k -> new LinkedList<>()).addFirst(value);
    }

    @Override
    public synchronized List<String> lrange(String key, long start, long stop) {
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return List.of();
        }
        int[] range = normalize(list.size(), start, stop);
        if (range == null) {
            return List.of();
        }
        return new ArrayList<>(list.subList(range[0], range[1] + 1));
    }

    @Override
    public synchronized long llen(String key) {
        LinkedList<String> list = lists.get(key);
        return list == null ? 0 : list.size();
    }

    @Override
    public synchronized long lrem(String key, long count, String value) {
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return 0;
        }
        long limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
        long removed = 0;
        if (count >= 0) {
            Iterator<String> it = list.iterator();
            while (it.hasNext() && removed < limit) {
                if (it.next().equals(value)) {
                    it.remove();
                    removed++;
                }
            }
        } else {
            ListIterator<String> it = list.listIterator(list.size());
            while (it.hasPrevious() && removed < limit) {
                if (it.previous().equals(value)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return removed;
    }

    @Override
    public synchronized void ltrim(String key, long start, long stop) {
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return;
        }
        int[] range = normalize(list.size(), start, stop);
        if (range == null) {
            lists.remove(key);
            return;
        }
        lists.put(key, new LinkedList<>(list.subList(range[0], range[1] + 1)));
    }

    // ========== Sorted Set ==========

    @Override
    public synchronized void zadd(String key, String member, double score) {
        sortedSets.computeIfAbsent(key, k -> new HashMap<>()).put(member, score);
    }

    @Override
    public synchronized List<String> zrangeByScore(String key, double min, double max, long offset, long count) {
        Map<String, Double> zset = sortedSets.get(key);
        if (zset == null || count <= 0) {
            return List.of();
        }
        return zset.entrySet().stream()
                .filter(e -> e.getValue() >= min && e.getValue() <= max)
                .sorted(BY_SCORE)
                .skip(Math.max(offset, 0))
                .limit(count)
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public synchronized long zrem(String key, String member) {
        Map<String, Double> zset = sortedSets.get(key);
        if (zset == null || zset.remove(member) == null) {
            return 0;
        }
        if (zset.isEmpty()) {
            sortedSets.remove(key);
        }
        return 1;
    }

    @Override
    public synchronized long zcard(String key) {
        Map<String, Double> zset = sortedSets.get(key);
        return zset == null ? 0 : zset.size();
    }

    // ========== internal ==========

    private ValueEntry liveValue(String key) {
        ValueEntry entry = values.get(key);
        if (entry != null && entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    /**
     * 按 Redis 规则把 [start, stop] 换算为合法的下标区间，区间为空时返回 null
     */
    private static int[] normalize(int size, long start, long stop) {
        long from = start < 0 ? size + start : start;
        long to = stop < 0 ? size + stop : stop;
        from = Math.max(from, 0);
        to = Math.min(to, size - 1L);
        if (from > to || from >= size) {
            return null;
        }
        return new int[]{(int) from, (int) to};
    }

    private static final class ValueEntry {
        final String value;
        final Instant expiresAt;

        ValueEntry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
