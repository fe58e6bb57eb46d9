package blog.platform.interceptor;

import blog.platform.exception.UnauthorizedException;
import blog.platform.security.AuthenticatedUser;
import blog.platform.security.BearerTokenParser;
import blog.platform.security.InvalidTokenException;
import blog.platform.security.TokenClaims;
import blog.platform.security.TokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Verifies the bearer token for handlers annotated with {@link RequireAuth}.
 * Public handlers pass through untouched, even when they carry a bad token.
 */
@Component
@Slf4j
public class BearerAuthInterceptor implements HandlerInterceptor {

    public static final String AUTHENTICATED_USER_ATTRIBUTE = BearerAuthInterceptor.class.getName() + ".user";

    @Autowired
    private TokenService tokenService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod) || !handlerMethod.hasMethodAnnotation(RequireAuth.class)) {
            return true;
        }

        String token = BearerTokenParser.parse(request.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(() -> {
                    log.debug("Missing or malformed Authorization header for {}", request.getRequestURI());
                    return new UnauthorizedException("missing bearer token");
                });

        TokenClaims claims;
        try {
            claims = tokenService.verify(token);
        } catch (InvalidTokenException e) {
            log.debug("Rejected bearer token for {}: {}", request.getRequestURI(), e.getMessage());
            throw new UnauthorizedException("invalid bearer token");
        }

        request.setAttribute(AUTHENTICATED_USER_ATTRIBUTE, AuthenticatedUser.from(claims));
        log.debug("Authenticated userId={} for {}", claims.getUserId(), request.getRequestURI());
        return true;
    }
}
