package blog.platform.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed application settings under the "blog" prefix.
 * Validated at startup; an invalid value prevents the context from starting.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "blog")
public class BlogProperties {

    @Valid
    private Jwt jwt = new Jwt();

    @Valid
    private Http http = new Http();

    @Valid
    private Grpc grpc = new Grpc();

    @Data
    public static class Jwt {
        /**
         * HMAC signing secret
         */
        @NotBlank(message = "blog.jwt.secret is required")
        @Size(min = 32, message = "blog.jwt.secret must be at least 32 characters")
        private String secret;

        /**
         * Token lifetime; values <= 0 fall back to 3600
         */
        private long ttlSeconds = 3600;

        /**
         * Clock skew tolerated when checking expiry
         */
        @Min(0)
        private long leewaySeconds = 10;
    }

    @Data
    public static class Http {
        @Min(1)
        private int concurrencyLimit = 256;

        /**
         * How long a request may wait for a free slot before being rejected
         */
        @Min(0)
        private long acquireTimeoutMs = 100;

        @Min(1)
        private long requestBodyLimitBytes = 1024 * 1024;
    }

    @Data
    public static class Grpc {
        private boolean enabled = true;

        /**
         * Listen port; 0 picks an ephemeral port
         */
        @Min(0)
        private int port = 50051;

        @Min(1)
        private int concurrencyLimit = 256;

        @Min(1)
        private long requestTimeoutSeconds = 10;

        @Min(1)
        private int maxInboundMessageSizeBytes = 4 * 1024 * 1024;
    }
}
