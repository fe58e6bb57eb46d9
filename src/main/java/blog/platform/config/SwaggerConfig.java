package blog.platform.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 * Declares the bearer token scheme used by the protected post endpoints
 */
@Configuration
public class SwaggerConfig {

    public static final String BEARER_SCHEME = "bearer_auth";

    @Value("${server.port:8080}")
    private String serverPort;

    @Value("${blog.grpc.port:50051}")
    private int grpcPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(apiServers())
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    private Info apiInfo() {
        return new Info()
                .title("Blog Platform API")
                .description("User registration, login and post management. " +
                             "Mutating post endpoints require an Authorization: Bearer <token> header. " +
                             "The same operations are served over gRPC (blog.BlogService) on port " + grpcPort + ".")
                .version("1.0.0");
    }

    private List<Server> apiServers() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        return List.of(localServer);
    }
}
