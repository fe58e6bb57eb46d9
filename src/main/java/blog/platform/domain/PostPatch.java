package blog.platform.domain;

import lombok.Value;

/**
 * Replacement title and content for an owned post
 */
@Value
public class PostPatch {
    String title;
    String content;
}
