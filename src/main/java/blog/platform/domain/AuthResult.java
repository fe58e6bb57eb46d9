package blog.platform.domain;

import lombok.Value;

/**
 * Outcome of a successful register or login
 */
@Value
public class AuthResult {
    User user;
    String accessToken;

    @Override
    public String toString() {
        return "AuthResult(user=" + user + ")";
    }
}
