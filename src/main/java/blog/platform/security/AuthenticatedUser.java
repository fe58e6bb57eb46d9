package blog.platform.security;

import lombok.Value;

/**
 * Caller identity established from a verified bearer token
 */
@Value
public class AuthenticatedUser {
    long userId;
    String username;

    public static AuthenticatedUser from(TokenClaims claims) {
        return new AuthenticatedUser(claims.getUserId(), claims.getUsername());
    }
}
