package blog.platform.dto;

import blog.platform.domain.AuthResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Access token and the authenticated user")
public class AuthResponse {

    @ToString.Exclude
    @Schema(description = "Bearer token for protected endpoints")
    private String accessToken;

    private UserResponse user;

    public static AuthResponse fromResult(AuthResult result) {
        return AuthResponse.builder()
                .accessToken(result.getAccessToken())
                .user(UserResponse.fromUser(result.getUser()))
                .build();
    }
}
