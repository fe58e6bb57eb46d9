package blog.platform.exception;

/**
 * Caller is authenticated but does not own the resource
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException() {
        super("forbidden");
    }
}
