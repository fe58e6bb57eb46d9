package blog.platform.grpc;

import blog.platform.domain.PageRequest;
import blog.platform.grpc.proto.AuthResponse;
import blog.platform.grpc.proto.BlogServiceGrpc;
import blog.platform.grpc.proto.CreatePostRequest;
import blog.platform.grpc.proto.DeletePostRequest;
import blog.platform.grpc.proto.GetPostRequest;
import blog.platform.grpc.proto.ListPostsRequest;
import blog.platform.grpc.proto.ListPostsResponse;
import blog.platform.grpc.proto.LoginRequest;
import blog.platform.grpc.proto.Post;
import blog.platform.grpc.proto.RegisterRequest;
import blog.platform.grpc.proto.UpdatePostRequest;
import blog.platform.security.AuthenticatedUser;
import blog.platform.service.AuthService;
import blog.platform.service.Pagination;
import blog.platform.service.PostService;
import com.google.protobuf.Empty;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * gRPC adapter over the auth and post services.
 * Every domain error is translated by {@link GrpcStatusMapper}.
 */
@Slf4j
@Component
public class GrpcBlogService extends BlogServiceGrpc.BlogServiceImplBase {

    private final AuthService authService;

    private final PostService postService;

    public GrpcBlogService(AuthService authService, PostService postService) {
        this.authService = authService;
        this.postService = postService;
    }

    @Override
    public void register(RegisterRequest request, StreamObserver<AuthResponse> responseObserver) {
        log.info("gRPC register: username={}", request.getUsername());
        respond(responseObserver, () -> GrpcMappers.toProto(
                authService.register(request.getUsername(), request.getEmail(), request.getPassword())));
    }

    @Override
    public void login(LoginRequest request, StreamObserver<AuthResponse> responseObserver) {
        log.debug("gRPC login: username={}", request.getUsername());
        respond(responseObserver, () -> GrpcMappers.toProto(
                authService.login(request.getUsername(), request.getPassword())));
    }

    @Override
    public void createPost(CreatePostRequest request, StreamObserver<Post> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            return GrpcMappers.toProto(postService.create(user.getUserId(), request.getTitle(), request.getContent()));
        });
    }

    @Override
    public void getPost(GetPostRequest request, StreamObserver<Post> responseObserver) {
        respond(responseObserver, () -> GrpcMappers.toProto(postService.get(request.getId())));
    }

    @Override
    public void updatePost(UpdatePostRequest request, StreamObserver<Post> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            return GrpcMappers.toProto(postService.update(
                    user.getUserId(), request.getId(), request.getTitle(), request.getContent()));
        });
    }

    @Override
    public void deletePost(DeletePostRequest request, StreamObserver<Empty> responseObserver) {
        respond(responseObserver, () -> {
            AuthenticatedUser user = currentUser();
            postService.delete(user.getUserId(), request.getId());
            return Empty.getDefaultInstance();
        });
    }

    /**
     * page/page_size are unsigned on the wire and are widened before validation
     */
    @Override
    public void listPosts(ListPostsRequest request, StreamObserver<ListPostsResponse> responseObserver) {
        respond(responseObserver, () -> {
            PageRequest page = Pagination.resolvePage(
                    Integer.toUnsignedLong(request.getPage()), Integer.toUnsignedLong(request.getPageSize()));
            return GrpcMappers.toProto(postService.list(page.getPageSize(), Pagination.toOffset(page)));
        });
    }

    private static AuthenticatedUser currentUser() {
        AuthenticatedUser user = GrpcAuthInterceptor.AUTHENTICATED_USER.get();
        if (user == null) {
            throw Status.UNAUTHENTICATED.withDescription("missing bearer token").asRuntimeException();
        }
        return user;
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> action) {
        T response;
        try {
            response = action.get();
        } catch (RuntimeException e) {
            responseObserver.onError(GrpcStatusMapper.toStatus(e));
            return;
        }
        if (Context.current().isCancelled()) {
            log.warn("gRPC call finished after its deadline or cancellation");
            responseObserver.onError(Status.DEADLINE_EXCEEDED.withDescription("request timed out").asRuntimeException());
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
