package xyz.firestige.redis.guard.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xyz.firestige.redis.guard.exception.GuardSerializationException;

/**
 * 存储记录的 JSON 编解码
 *
 * <p>时间字段以 ISO-8601 文本存储；{@link #canonical()} 额外对 Map 键和 Bean 属性排序，用于内容哈希。
 */
public final class JsonSupport {

    private JsonSupport() {
    }

    /**
     * @return 用于存储记录的 ObjectMapper
     */
    public static ObjectMapper create() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * @return 输出稳定（键有序）的 ObjectMapper
     */
    public static ObjectMapper canonical() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
    }

    public static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GuardSerializationException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(ObjectMapper mapper, String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new GuardSerializationException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
