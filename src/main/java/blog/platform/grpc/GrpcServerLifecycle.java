package blog.platform.grpc;

import blog.platform.config.BlogProperties;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the gRPC listener alongside the servlet container, sharing its service beans.
 * Disabled with blog.grpc.enabled=false.
 */
@Slf4j
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final BlogProperties.Grpc properties;

    private final GrpcBlogService blogService;

    private final GrpcAuthInterceptor authInterceptor;

    private final GrpcDeadlineInterceptor deadlineInterceptor;

    private final GrpcConcurrencyLimitInterceptor concurrencyLimitInterceptor;

    private volatile Server server;

    private ExecutorService executor;

    public GrpcServerLifecycle(BlogProperties properties,
                               GrpcBlogService blogService,
                               GrpcAuthInterceptor authInterceptor,
                               GrpcDeadlineInterceptor deadlineInterceptor,
                               GrpcConcurrencyLimitInterceptor concurrencyLimitInterceptor) {
        this.properties = properties.getGrpc();
        this.blogService = blogService;
        this.authInterceptor = authInterceptor;
        this.deadlineInterceptor = deadlineInterceptor;
        this.concurrencyLimitInterceptor = concurrencyLimitInterceptor;
    }

    /**
     * The blog service wrapped in its interceptors.
     * The concurrency limit runs first, then the deadline, then authentication.
     */
    public ServerServiceDefinition interceptedService() {
        // ServerInterceptors.intercept runs the last interceptor first
        return ServerInterceptors.intercept(blogService, authInterceptor, deadlineInterceptor, concurrencyLimitInterceptor);
    }

    @Override
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("gRPC server disabled");
            return;
        }
        if (server != null) {
            return;
        }

        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(properties.getConcurrencyLimit(), runnable -> {
            Thread thread = new Thread(runnable, "grpc-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        Server built = NettyServerBuilder.forPort(properties.getPort())
                .maxInboundMessageSize(properties.getMaxInboundMessageSizeBytes())
                .executor(executor)
                .addService(interceptedService())
                .build();
        try {
            built.start();
        } catch (IOException e) {
            executor.shutdownNow();
            throw new UncheckedIOException("Failed to start gRPC server on port " + properties.getPort(), e);
        }
        server = built;
        log.info("gRPC server listening on port {}", built.getPort());
    }

    @Override
    public synchronized void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        log.info("Stopping gRPC server");
        running.shutdown();
        try {
            if (!running.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not drain within {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        } finally {
            executor.shutdownNow();
            server = null;
        }
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    /**
     * Bound port, useful when configured with port 0; -1 when not running
     */
    public int getPort() {
        Server running = server;
        return running == null ? -1 : running.getPort();
    }
}
