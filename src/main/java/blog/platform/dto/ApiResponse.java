package blog.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Envelope for every REST response body.
 * Failures always carry a single human-readable message; validation failures
 * additionally carry {field: reason} in data.
 *
 * @param <T> Response data type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    /**
     * HTTP status code mirrored in the body
     */
    private Integer code;

    private String message;

    private T data;

    /**
     * Epoch millis when the response was produced
     */
    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    public static <T> ApiResponse<T> success(T data) {
        return success(200, "Success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return success(200, message, data);
    }

    public static <T> ApiResponse<T> success(Integer code, String message, T data) {
        return ApiResponse.<T>builder()
                .code(code)
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(Integer code, String message) {
        return ApiResponse.<T>builder()
                .code(code)
                .message(message)
                .build();
    }

    /**
     * 400 response naming the offending fields
     */
    public static ApiResponse<Map<String, String>> invalid(String message, Map<String, String> fieldErrors) {
        return ApiResponse.<Map<String, String>>builder()
                .code(400)
                .message(message)
                .data(fieldErrors)
                .build();
    }
}
