package blog.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full replacement of title and content
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Update post request")
public class UpdatePostRequest {
    @NotNull(message = "is required")
    @Size(max = 255, message = "must be 1..255 chars")
    @Schema(description = "New title", example = "Hello again")
    private String title;

    @NotNull(message = "is required")
    @Schema(description = "New body", example = "Edited.")
    private String content;
}
