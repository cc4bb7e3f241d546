package xyz.firestige.redis.guard.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.redis.guard.support.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 内容哈希
 *
 * <p>字符串直接参与计算；byte[] 按 UTF-8 解码；其他对象先序列化为键有序的 JSON。
 * 结果为 SHA-256 十六进制摘要的前 16 位，因此键顺序不同但内容相同的 Map 得到相同哈希。
 */
public final class ContentHasher {

    public static final int HASH_LENGTH = 16;

    private static final ObjectMapper CANONICAL = JsonSupport.canonical();

    private ContentHasher() {
    }

    public static String hash(Object content) {
        return sha256(canonicalize(content)).substring(0, HASH_LENGTH);
    }

    static String canonicalize(Object content) {
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return JsonSupport.write(CANONICAL, content);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
