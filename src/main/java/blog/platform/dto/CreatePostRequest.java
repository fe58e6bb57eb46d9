package blog.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create post request")
public class CreatePostRequest {
    @NotNull(message = "is required")
    @Size(max = 255, message = "must be 1..255 chars")
    @Schema(description = "Title, 1..255 characters", example = "Hello world")
    private String title;

    @NotNull(message = "is required")
    @Schema(description = "Post body", example = "First post.")
    private String content;
}
