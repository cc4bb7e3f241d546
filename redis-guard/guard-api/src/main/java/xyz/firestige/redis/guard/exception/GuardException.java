package xyz.firestige.redis.guard.exception;

/**
 * redis-guard 基础异常
 *
 * @since 1.0
 */
public class GuardException extends RuntimeException {

    public GuardException(String message) {
        super(message);
    }

    public GuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
