package blog.platform.exception;

/**
 * Exception thrown when a listener has no free in-flight slot
 */
public class ConcurrencyLimitExceededException extends RuntimeException {
    public ConcurrencyLimitExceededException(String message) {
        super(message);
    }
}
