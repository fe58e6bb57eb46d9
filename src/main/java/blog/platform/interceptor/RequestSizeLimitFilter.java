package blog.platform.interceptor;

import blog.platform.config.BlogProperties;
import blog.platform.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Rejects requests whose declared Content-Length exceeds the configured body cap.
 * Runs as a servlet filter, before any handler reads the body.
 */
@Component
@Slf4j
public class RequestSizeLimitFilter extends OncePerRequestFilter {

    private final long limitBytes;

    private final ObjectMapper objectMapper;

    public RequestSizeLimitFilter(BlogProperties properties, ObjectMapper objectMapper) {
        this.limitBytes = properties.getHttp().getRequestBodyLimitBytes();
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long declared = request.getContentLengthLong();
        if (declared > limitBytes) {
            log.warn("Request body of {} bytes exceeds limit of {} for {}", declared, limitBytes, request.getRequestURI());
            response.setStatus(HttpStatus.PAYLOAD_TOO_LARGE.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), ApiResponse.error(413, "Request body too large"));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
