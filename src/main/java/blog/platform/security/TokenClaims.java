package blog.platform.security;

import lombok.Value;

import java.time.Instant;

/**
 * Identity carried by a verified access token
 */
@Value
public class TokenClaims {
    long userId;
    String username;
    Instant expiresAt;
}
