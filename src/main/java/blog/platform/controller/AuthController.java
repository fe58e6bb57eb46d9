package blog.platform.controller;

import blog.platform.domain.AuthResult;
import blog.platform.dto.ApiResponse;
import blog.platform.dto.AuthResponse;
import blog.platform.dto.LoginRequest;
import blog.platform.dto.RegisterRequest;
import blog.platform.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for registration and login
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@Validated
@Tag(name = "Authentication", description = "Register and log in to obtain a bearer token")
public class AuthController {

    @Autowired
    private AuthService authService;

    /**
     * Register a new user and log them in
     *
     * @param request the register request
     * @return API response with the access token and the created user
     */
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register", description = "Create an account and return an access token")
    public ApiResponse<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Register request: username={}", request.getUsername());
        AuthResult result = authService.register(request.getUsername(), request.getEmail(), request.getPassword());
        return ApiResponse.success(201, "User registered successfully", AuthResponse.fromResult(result));
    }

    /**
     * Exchange credentials for an access token
     */
    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Verify credentials and return an access token")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.debug("Login request: username={}", request.getUsername());
        AuthResult result = authService.login(request.getUsername(), request.getPassword());
        return ApiResponse.success(AuthResponse.fromResult(result));
    }
}
