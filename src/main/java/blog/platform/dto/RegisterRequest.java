package blog.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Upper bounds are checked on the raw values; trimming, minimums and format apply in the auth service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Register request")
public class RegisterRequest {
    @NotNull(message = "is required")
    @Size(max = 64, message = "must be 3..64 chars")
    @Schema(description = "Username, 3..64 characters after trimming", example = "john_doe")
    private String username;

    @NotNull(message = "is required")
    @Size(max = 254, message = "must be a valid email")
    @Schema(description = "Email address", example = "john@example.com")
    private String email;

    @NotNull(message = "is required")
    @Size(max = 128, message = "must be 8..128 chars")
    @ToString.Exclude
    @Schema(description = "Password, 8..128 characters", example = "securePassword123")
    private String password;
}
