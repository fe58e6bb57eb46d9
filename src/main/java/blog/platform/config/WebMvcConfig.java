package blog.platform.config;

import blog.platform.interceptor.AuthenticatedUserArgumentResolver;
import blog.platform.interceptor.BearerAuthInterceptor;
import blog.platform.interceptor.ConcurrencyLimitInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Web MVC configuration for registering interceptors
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private ConcurrencyLimitInterceptor concurrencyLimitInterceptor;

    @Autowired
    private BearerAuthInterceptor bearerAuthInterceptor;

    @Autowired
    private AuthenticatedUserArgumentResolver authenticatedUserArgumentResolver;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // concurrency first so rejected requests never reach token verification
        registry.addInterceptor(concurrencyLimitInterceptor)
                .addPathPatterns("/api/**", "/healthz")
                .order(0);
        registry.addInterceptor(bearerAuthInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(
                    "/api-docs/**",           // Exclude Swagger docs
                    "/swagger-ui/**",         // Exclude Swagger UI
                    "/swagger-ui.html"        // Exclude Swagger UI
                )
                .order(1);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(authenticatedUserArgumentResolver);
    }
}
