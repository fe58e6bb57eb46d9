package blog.platform.config;

import blog.platform.grpc.GrpcConcurrencyLimitInterceptor;
import blog.platform.interceptor.ConcurrencyLimitInterceptor;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration for Prometheus monitoring
 *
 * Configures:
 * - Common tags identifying the service
 * - Gauges for the free request slots of each listener
 */
@Slf4j
@Configuration
public class MetricsConfig {

    private static final List<Tag> COMMON_TAGS = List.of(
            Tag.of("service", "blog-platform"),
            Tag.of("component", "api")
    );

    @Bean
    public MeterBinder commonTagsBinder() {
        return (MeterRegistry registry) -> {
            registry.config().commonTags(COMMON_TAGS);
            log.info("Registered common metric tags: {}", COMMON_TAGS);
        };
    }

    /**
     * blog.requests.available_slots{transport=http|grpc}
     */
    @Bean
    public MeterBinder concurrencySlotsBinder(ConcurrencyLimitInterceptor httpLimit,
                                              GrpcConcurrencyLimitInterceptor grpcLimit) {
        return (MeterRegistry registry) -> {
            Gauge.builder("blog.requests.available_slots", httpLimit, ConcurrencyLimitInterceptor::availablePermits)
                    .tag("transport", "http")
                    .description("Free in-flight request slots")
                    .register(registry);
            Gauge.builder("blog.requests.available_slots", grpcLimit, GrpcConcurrencyLimitInterceptor::availablePermits)
                    .tag("transport", "grpc")
                    .description("Free in-flight request slots")
                    .register(registry);
        };
    }
}
