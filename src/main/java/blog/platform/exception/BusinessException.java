package blog.platform.exception;

/**
 * Base class for domain errors surfaced to the transport adapters
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
