package xyz.firestige.redis.guard.spring.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SpringRedisClient")
class SpringRedisClientTest {

    private StringRedisTemplate template;
    private ValueOperations<String, String> valueOps;
    private HashOperations<String, Object, Object> hashOps;
    private ListOperations<String, String> listOps;
    private ZSetOperations<String, String> zsetOps;
    private SpringRedisClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        template = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        hashOps = mock(HashOperations.class);
        listOps = mock(ListOperations.class);
        zsetOps = mock(ZSetOperations.class);
        when(template.opsForValue()).thenReturn(valueOps);
        when(template.<Object, Object>opsForHash()).thenReturn(hashOps);
        when(template.opsForList()).thenReturn(listOps);
        when(template.opsForZSet()).thenReturn(zsetOps);
        client = new SpringRedisClient(template);
    }

    @Test
    @DisplayName("setIfAbsent 映射到 SET NX，null 视为失败")
    void setIfAbsentMapsToSetNx() {
        when(valueOps.setIfAbsent("k", "v", Duration.ofMinutes(1))).thenReturn(true, (Boolean) null);

        assertThat(client.setIfAbsent("k", "v", Duration.ofMinutes(1))).isTrue();
        assertThat(client.setIfAbsent("k", "v", Duration.ofMinutes(1))).isFalse();
    }

    @Test
    @DisplayName("setWithTtl 在 TTL 为 null 时不设置过期")
    void setWithTtl() {
        client.setWithTtl("a", "1", Duration.ofSeconds(5));
        client.setWithTtl("b", "2", null);

        verify(valueOps).set("a", "1", Duration.ofSeconds(5));
        verify(valueOps).set("b", "2");
    }

    @Test
    @DisplayName("Hash 字段与值转换为字符串")
    void hgetAllConvertsToStrings() {
        when(hashOps.entries("h")).thenReturn(Map.of("retries_scheduled", "3"));
        when(hashOps.increment("h", "dead_letters", 1L)).thenReturn(4L);

        assertThat(client.hgetAll("h")).containsEntry("retries_scheduled", "3");
        assertThat(client.hincrBy("h", "dead_letters", 1)).isEqualTo(4L);
    }

    @Test
    @DisplayName("列表与有序集合操作透传，null 返回值视为空")
    void listAndSortedSetOperations() {
        when(listOps.range("l", 0, -1)).thenReturn(null);
        when(listOps.remove("l", 1, "x")).thenReturn(1L);
        when(zsetOps.rangeByScore("z", Double.NEGATIVE_INFINITY, 100.0, 0, 10))
            .thenReturn(new LinkedHashSet<>(List.of("a", "b")));
        when(zsetOps.remove("z", "a")).thenReturn(1L);

        assertThat(client.lrange("l", 0, -1)).isEmpty();
        assertThat(client.lrem("l", 1, "x")).isEqualTo(1L);
        assertThat(client.zrangeByScore("z", Double.NEGATIVE_INFINITY, 100.0, 0, 10)).containsExactly("a", "b");
        assertThat(client.zrem("z", "a")).isEqualTo(1L);
        assertThat(client.zcard("z")).isZero();
        assertThat(client.llen("l")).isZero();

        client.lpush("l", "v");
        client.ltrim("l", 0, 99);
        client.zadd("z", "m", 12.5);
        verify(listOps).leftPush("l", "v");
        verify(listOps).trim("l", 0, 99);
        verify(zsetOps).add("z", "m", 12.5);
    }

    @Test
    @DisplayName("delete / exists 的 null 返回值视为 false")
    void deleteAndExists() {
        when(template.delete("k")).thenReturn(true);

        assertThat(client.delete("k")).isTrue();
        assertThat(client.exists("k")).isFalse();
    }
}
