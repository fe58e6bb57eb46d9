package blog.platform.domain;

import blog.platform.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * Blog post. authorId is the owner and never changes after creation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Post {
    long id;
    String title;
    String content;
    long authorId;
    Instant createdAt;
    Instant updatedAt;

    public static Post of(long id, String title, String content, long authorId,
                          Instant createdAt, Instant updatedAt) {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (updatedAt.isBefore(createdAt)) {
            throw new ValidationException("updated_at", "must be >= created_at");
        }
        return new Post(
                Normalizer.positive("id", id),
                Normalizer.title(title),
                Normalizer.content(content),
                Normalizer.positive("author_id", authorId),
                createdAt,
                updatedAt);
    }

    public boolean isOwnedBy(long userId) {
        return authorId == userId;
    }
}
