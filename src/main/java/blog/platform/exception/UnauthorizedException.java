package blog.platform.exception;

/**
 * Missing, malformed or rejected bearer token
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }
}
