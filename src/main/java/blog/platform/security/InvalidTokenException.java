package blog.platform.security;

/**
 * Any token failure: bad signature, bad format, expired, missing claims.
 * Deliberately carries no detail about which check failed.
 */
public class InvalidTokenException extends RuntimeException {
    public InvalidTokenException() {
        super("invalid token");
    }
}
