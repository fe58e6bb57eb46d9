package blog.platform.grpc;

import blog.platform.grpc.proto.BlogServiceGrpc;
import blog.platform.security.AuthenticatedUser;
import blog.platform.security.BearerTokenParser;
import blog.platform.security.InvalidTokenException;
import blog.platform.security.TokenService;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Verifies the authorization metadata for the post mutation methods and
 * exposes the caller through {@link #AUTHENTICATED_USER}.
 */
@Slf4j
@Component
public class GrpcAuthInterceptor implements ServerInterceptor {

    public static final Context.Key<AuthenticatedUser> AUTHENTICATED_USER = Context.key("authenticated-user");

    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of(BearerTokenParser.AUTHORIZATION, Metadata.ASCII_STRING_MARSHALLER);

    private static final Set<String> PROTECTED_METHODS = Set.of(
            BlogServiceGrpc.getCreatePostMethod().getFullMethodName(),
            BlogServiceGrpc.getUpdatePostMethod().getFullMethodName(),
            BlogServiceGrpc.getDeletePostMethod().getFullMethodName());

    private final TokenService tokenService;

    public GrpcAuthInterceptor(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String method = call.getMethodDescriptor().getFullMethodName();
        if (!PROTECTED_METHODS.contains(method)) {
            return next.startCall(call, headers);
        }

        Optional<String> token = BearerTokenParser.parse(headers.get(AUTHORIZATION));
        if (token.isEmpty()) {
            log.debug("Missing or malformed authorization metadata for {}", method);
            return reject(call, "missing bearer token");
        }

        AuthenticatedUser user;
        try {
            user = AuthenticatedUser.from(tokenService.verify(token.get()));
        } catch (InvalidTokenException e) {
            log.debug("Rejected bearer token for {}: {}", method, e.getMessage());
            return reject(call, "invalid bearer token");
        }

        Context context = Context.current().withValue(AUTHENTICATED_USER, user);
        return Contexts.interceptCall(context, call, headers, next);
    }

    private static <ReqT, RespT> ServerCall.Listener<ReqT> reject(ServerCall<ReqT, RespT> call, String description) {
        call.close(Status.UNAUTHENTICATED.withDescription(description), new Metadata());
        return new ServerCall.Listener<>() {
        };
    }
}
