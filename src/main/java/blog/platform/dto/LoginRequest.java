package blog.platform.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Login request")
public class LoginRequest {
    @NotNull(message = "is required")
    @Size(max = 64, message = "must be 1..64 chars")
    @Schema(description = "Username", example = "john_doe")
    private String username;

    @NotNull(message = "is required")
    @ToString.Exclude
    @Schema(description = "Password", example = "securePassword123")
    private String password;
}
