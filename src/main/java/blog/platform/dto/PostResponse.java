package blog.platform.dto;

import blog.platform.domain.Post;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Post response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Post")
public class PostResponse {

    @Schema(description = "Post ID", example = "12345")
    private Long id;

    @Schema(description = "Title", example = "Hello world")
    private String title;

    @Schema(description = "Body", example = "First post.")
    private String content;

    @Schema(description = "Owner user ID", example = "1")
    private Long authorId;

    @Schema(description = "Created timestamp (UTC)", example = "2025-01-15T10:30:00Z")
    private Instant createdAt;

    @Schema(description = "Updated timestamp (UTC)", example = "2025-01-15T10:31:00Z")
    private Instant updatedAt;

    /**
     * Convert Post entity to PostResponse DTO
     */
    public static PostResponse fromPost(Post post) {
        if (post == null) {
            return null;
        }

        return PostResponse.builder()
                .id(post.getId())
                .title(post.getTitle())
                .content(post.getContent())
                .authorId(post.getAuthorId())
                .createdAt(post.getCreatedAt())
                .updatedAt(post.getUpdatedAt())
                .build();
    }
}
