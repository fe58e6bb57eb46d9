package blog.platform.exception;

/**
 * Login failed. Deliberately does not say whether the username exists.
 */
public class InvalidCredentialsException extends BusinessException {
    public InvalidCredentialsException() {
        super("invalid credentials");
    }
}
