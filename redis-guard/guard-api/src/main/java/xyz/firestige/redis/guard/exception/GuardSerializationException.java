package xyz.firestige.redis.guard.exception;

/**
 * 存储记录的 JSON 编解码失败
 *
 * @since 1.0
 */
public class GuardSerializationException extends GuardException {

    public GuardSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
