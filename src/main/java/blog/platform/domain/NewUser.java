package blog.platform.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Normalized registration data ready to persist
 */
@Value
public class NewUser {
    String username;
    String email;
    String passwordHash;
    Instant createdAt;

    @Override
    public String toString() {
        return "NewUser(username=" + username + ", email=" + email + ")";
    }
}
