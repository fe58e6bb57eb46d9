package blog.platform.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class NewPost {
    String title;
    String content;
    long authorId;
    Instant createdAt;
}
