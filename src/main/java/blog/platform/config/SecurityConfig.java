package blog.platform.config;

import blog.platform.security.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source and token service wiring
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BlogProperties.class)
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenService tokenService(BlogProperties properties, Clock clock) {
        BlogProperties.Jwt jwt = properties.getJwt();
        TokenService tokenService = new TokenService(jwt.getSecret(), jwt.getTtlSeconds(), jwt.getLeewaySeconds(), clock);
        if (jwt.getTtlSeconds() <= 0) {
            log.warn("blog.jwt.ttl-seconds={} is not positive, using {}s", jwt.getTtlSeconds(), tokenService.getTtlSeconds());
        }
        return tokenService;
    }
}
