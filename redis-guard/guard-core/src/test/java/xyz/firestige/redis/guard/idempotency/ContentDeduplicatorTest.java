package xyz.firestige.redis.guard.idempotency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.ContentCheck;
import xyz.firestige.redis.guard.store.InMemoryRedisClient;
import xyz.firestige.redis.guard.testutil.MutableClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentDeduplicator")
class ContentDeduplicatorTest {

    private MutableClock clock;
    private InMemoryRedisClient redis;
    private ContentDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
        redis = new InMemoryRedisClient(clock);
        deduplicator = new ContentDeduplicator(redis, IdempotencyConfig.defaults(), "scraped");
    }

    @Test
    @DisplayName("首次出现的内容需要处理，再次出现时为重复")
    void secondSightingIsDuplicate() {
        ContentCheck first = deduplicator.isDuplicate("<html>pricing</html>");
        ContentCheck second = deduplicator.isDuplicate("<html>pricing</html>");

        assertThat(first.shouldProcess()).isTrue();
        assertThat(second.shouldProcess()).isFalse();
        assertThat(redis.exists("redis-guard:dedup:scraped:" + first.contentHash())).isTrue();
    }

    @Test
    @DisplayName("标记 7 天后过期")
    void markerExpiresAfterSevenDays() {
        String hash = deduplicator.isDuplicate("page").contentHash();

        clock.advance(Duration.ofDays(7));

        assertThat(deduplicator.isSeen(hash)).isFalse();
        assertThat(deduplicator.isDuplicate("page").shouldProcess()).isTrue();
    }

    @Test
    @DisplayName("markSeen 之后 isSeen 为 true，命名空间互不影响")
    void markSeenIsNamespaced() {
        String hash = ContentHasher.hash("report");
        deduplicator.markSeen(hash);

        ContentDeduplicator other = new ContentDeduplicator(redis, IdempotencyConfig.defaults());

        assertThat(deduplicator.isSeen(hash)).isTrue();
        assertThat(other.isSeen(hash)).isFalse();
        assertThat(other.getNamespace()).isEqualTo("content");
    }
}
