package blog.platform.exception;

/**
 * Internal fault. The detail is for logs only and never reaches clients.
 */
public class UnexpectedException extends BusinessException {
    public UnexpectedException(String detail) {
        super("unexpected domain error: " + detail);
    }

    public UnexpectedException(String detail, Throwable cause) {
        super("unexpected domain error: " + detail, cause);
    }
}
