package blog.platform.security;

/**
 * Outcome of checking a plaintext password against a stored hash
 */
public enum PasswordVerification {
    MATCH,
    MISMATCH,
    /**
     * Stored hash could not be parsed. This is a data fault, not a credential failure.
     */
    MALFORMED
}
