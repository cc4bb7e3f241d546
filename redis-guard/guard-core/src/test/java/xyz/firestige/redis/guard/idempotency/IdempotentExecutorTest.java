package xyz.firestige.redis.guard.idempotency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.redis.guard.api.IdempotencyRecord;
import xyz.firestige.redis.guard.api.IdempotencyStatus;
import xyz.firestige.redis.guard.exception.IdempotencyConflictException;
import xyz.firestige.redis.guard.store.InMemoryRedisClient;
import xyz.firestige.redis.guard.support.JsonSupport;
import xyz.firestige.redis.guard.testutil.MutableClock;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdempotentExecutor")
class IdempotentExecutorTest {

    private MutableClock clock;
    private InMemoryRedisClient store;
    private RedisIdempotencyManager manager;
    private IdempotentExecutor executor;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
        store = new InMemoryRedisClient(clock);
        manager = new RedisIdempotencyManager(store);
        executor = new IdempotentExecutor(manager);
        calls = new AtomicInteger();
    }

    @Test
    @DisplayName("同一个 key 第二次返回缓存结果，不再执行")
    void secondCallReturnsCachedResult() throws Exception {
        Receipt first = executor.execute("pay-1", Receipt.class, () -> {
            calls.incrementAndGet();
            return new Receipt("r-1", 250);
        });
        Receipt second = executor.execute("pay-1", Receipt.class, () -> {
            calls.incrementAndGet();
            return new Receipt("r-2", 999);
        });

        assertThat(calls).hasValue(1);
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("key 为空时每次都执行")
    void blankKeyAlwaysExecutes() throws Exception {
        executor.execute(null, Integer.class, calls::incrementAndGet);
        executor.execute(" ", Integer.class, calls::incrementAndGet);

        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("处理中的 key 被拒绝")
    void processingKeyIsRejected() {
        manager.checkAndSet("pay-2");

        assertThatThrownBy(() -> executor.execute("pay-2", Integer.class, calls::incrementAndGet))
                .isInstanceOfSatisfying(IdempotencyConflictException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(IdempotencyStatus.PROCESSING));
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("执行失败时记录错误并原样抛出，之后同一个 key 被拒绝")
    void failureIsRecordedAndRethrown() {
        assertThatThrownBy(() -> executor.execute("pay-3", Integer.class, () -> {
            throw new IllegalStateException("card declined");
        })).isInstanceOf(IllegalStateException.class).hasMessage("card declined");

        assertThat(manager.getStatus("pay-3")).contains(IdempotencyStatus.ERROR);
        assertThatThrownBy(() -> executor.execute("pay-3", Integer.class, calls::incrementAndGet))
                .isInstanceOfSatisfying(IdempotencyConflictException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(IdempotencyStatus.ERROR));
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("调用抛出 Error 时同样记录错误，错误 TTL 过后可以重新执行")
    void errorIsRecordedWithShortTtl() throws Exception {
        assertThatThrownBy(() -> executor.execute("pay-4", Integer.class, () -> {
            throw new StackOverflowError();
        })).isInstanceOf(StackOverflowError.class);

        assertThat(manager.getStatus("pay-4")).contains(IdempotencyStatus.ERROR);
        assertThat(storedError("pay-4")).isEqualTo("java.lang.StackOverflowError");

        clock.advance(IdempotencyConfig.DEFAULT_ERROR_TTL_CAP.plusSeconds(1));

        assertThat(executor.execute("pay-4", Integer.class, calls::incrementAndGet)).isEqualTo(1);
    }

    private String storedError(String key) {
        String json = store.get(manager.getConfig().idempotencyKey(key));
        return JsonSupport.read(JsonSupport.create(), json, IdempotencyRecord.class).error();
    }

    record Receipt(String id, int amount) {
    }
}
