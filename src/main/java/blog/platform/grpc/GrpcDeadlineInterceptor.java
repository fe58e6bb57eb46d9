package blog.platform.grpc;

import blog.platform.config.BlogProperties;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Attaches a server-side deadline to every call.
 * A tighter deadline sent by the client still wins.
 */
@Component
public class GrpcDeadlineInterceptor implements ServerInterceptor, DisposableBean {

    private final long timeoutSeconds;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "grpc-deadline");
        thread.setDaemon(true);
        return thread;
    });

    public GrpcDeadlineInterceptor(BlogProperties properties) {
        this.timeoutSeconds = properties.getGrpc().getRequestTimeoutSeconds();
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        Context.CancellableContext context = Context.current().withDeadlineAfter(timeoutSeconds, TimeUnit.SECONDS, scheduler);
        ServerCall.Listener<ReqT> listener;
        try {
            listener = Contexts.interceptCall(context, call, headers, next);
        } catch (RuntimeException e) {
            context.cancel(e);
            throw e;
        }

        // cancel the deadline timer as soon as the call is done
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(listener) {
            @Override
            public void onComplete() {
                try {
                    super.onComplete();
                } finally {
                    context.cancel(null);
                }
            }

            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    context.cancel(null);
                }
            }
        };
    }

    @Override
    public void destroy() {
        scheduler.shutdownNow();
    }
}
