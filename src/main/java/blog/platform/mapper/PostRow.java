package blog.platform.mapper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the posts table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostRow {
    private Long id;
    private String title;
    private String content;

    /**
     * Owner, references users.id
     */
    private Long authorId;

    private Instant createdAt;
    private Instant updatedAt;
}
