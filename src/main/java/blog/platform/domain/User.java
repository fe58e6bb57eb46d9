package blog.platform.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * Registered account. The credential hash is deliberately not part of this entity.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class User {
    long id;
    String username;
    String email;
    Instant createdAt;

    /**
     * Build a user, normalizing and validating every field
     */
    public static User of(long id, String username, String email, Instant createdAt) {
        return new User(
                Normalizer.positive("id", id),
                Normalizer.registerUsername(username),
                Normalizer.email(email),
                Objects.requireNonNull(createdAt, "createdAt"));
    }
}
