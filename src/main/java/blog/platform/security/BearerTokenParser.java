package blog.platform.security;

import java.util.Optional;

/**
 * Extracts the token from an {@code Authorization: Bearer <token>} value.
 * Shared by the HTTP and gRPC adapters.
 */
public final class BearerTokenParser {

    public static final String AUTHORIZATION = "authorization";

    private static final String SCHEME = "bearer";

    private BearerTokenParser() {
    }

    /**
     * @return the token, or empty when the header is absent or not exactly "Bearer &lt;token&gt;"
     */
    public static Optional<String> parse(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        String[] parts = headerValue.trim().split("\\s+");
        if (parts.length != 2 || !parts[0].equalsIgnoreCase(SCHEME) || parts[1].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parts[1]);
    }
}
