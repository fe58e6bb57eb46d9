package blog.platform.controller;

import blog.platform.dto.ApiResponse;
import blog.platform.mapper.HealthMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe that also checks the database round trip
 */
@Slf4j
@RestController
@Tag(name = "Health")
public class HealthController {

    @Autowired
    private HealthMapper healthMapper;

    @GetMapping("/healthz")
    @Operation(summary = "Health check", description = "Returns UP when the database answers SELECT 1")
    public ResponseEntity<ApiResponse<Map<String, String>>> health() {
        try {
            healthMapper.ping();
            return ResponseEntity.ok(ApiResponse.success(Map.of("status", "UP")));
        } catch (DataAccessException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.success(503, "Database unavailable", Map.of("status", "DOWN")));
        }
    }
}
