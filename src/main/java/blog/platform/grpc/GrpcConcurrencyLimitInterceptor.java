package blog.platform.grpc;

import blog.platform.config.BlogProperties;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps in-flight gRPC calls; a call arriving at the cap fails fast with RESOURCE_EXHAUSTED.
 * The slot is released once, when the call is closed or cancelled.
 */
@Slf4j
@Component
public class GrpcConcurrencyLimitInterceptor implements ServerInterceptor {

    private final Semaphore permits;

    private final int limit;

    public GrpcConcurrencyLimitInterceptor(BlogProperties properties) {
        this.limit = properties.getGrpc().getConcurrencyLimit();
        this.permits = new Semaphore(limit);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        if (!permits.tryAcquire()) {
            log.warn("gRPC concurrency limit of {} reached, rejecting {}",
                    limit, call.getMethodDescriptor().getFullMethodName());
            call.close(Status.RESOURCE_EXHAUSTED.withDescription("too many requests in flight"), new Metadata());
            return new ServerCall.Listener<>() {
            };
        }

        AtomicBoolean released = new AtomicBoolean();
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        };

        ServerCall<ReqT, RespT> releasingCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                try {
                    super.close(status, trailers);
                } finally {
                    release.run();
                }
            }
        };

        ServerCall.Listener<ReqT> listener;
        try {
            listener = next.startCall(releasingCall, headers);
        } catch (RuntimeException e) {
            release.run();
            throw e;
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    release.run();
                }
            }

            @Override
            public void onComplete() {
                try {
                    super.onComplete();
                } finally {
                    release.run();
                }
            }
        };
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
