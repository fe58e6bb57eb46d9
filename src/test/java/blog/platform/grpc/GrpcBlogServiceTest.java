package blog.platform.grpc;

import blog.platform.BaseIntegrationTest;
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
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * gRPC adapter end to end over an in-process transport with the production interceptor chain
 */
class GrpcBlogServiceTest extends BaseIntegrationTest {

    @Autowired
    private GrpcServerLifecycle grpcServerLifecycle;

    private Server server;
    private ManagedChannel channel;
    private BlogServiceGrpc.BlogServiceBlockingStub stub;

    @BeforeEach
    void startServer() throws IOException {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(grpcServerLifecycle.interceptedService())
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = BlogServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void stopServer() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    @Test
    void listenerIsNotStartedWhenDisabled() {
        assertThat(grpcServerLifecycle.isRunning()).isFalse();
        assertThat(grpcServerLifecycle.getPort()).isEqualTo(-1);
    }

    @Test
    void registerAndLogin() {
        AuthResponse registered = register("alice");

        assertThat(registered.getAccessToken()).isNotEmpty();
        assertThat(registered.getUser().getUsername()).isEqualTo("alice");
        assertThat(registered.getUser().getEmail()).isEqualTo("alice@example.com");
        assertThat(registered.getUser().getCreatedAt().getSeconds()).isPositive();

        AuthResponse loggedIn = stub.login(LoginRequest.newBuilder().setUsername("alice").setPassword(PASSWORD).build());
        assertThat(loggedIn.getUser().getId()).isEqualTo(registered.getUser().getId());
    }

    @Test
    void duplicateRegistrationIsAlreadyExists() {
        register("alice");

        assertThatThrownBy(() -> register("alice"))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.ALREADY_EXISTS));
    }

    @Test
    void wrongPasswordIsUnauthenticated() {
        register("alice");

        assertThatThrownBy(() -> stub.login(LoginRequest.newBuilder().setUsername("alice").setPassword("nope-nope").build()))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.UNAUTHENTICATED));
        assertThatThrownBy(() -> stub.login(LoginRequest.newBuilder().setUsername("ghost").setPassword("nope-nope").build()))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.UNAUTHENTICATED));
    }

    @Test
    @DisplayName("over-long email is INVALID_ARGUMENT, not an internal error")
    void overLongEmailIsInvalidArgument() {
        assertThatThrownBy(() -> stub.register(RegisterRequest.newBuilder()
                .setUsername("alice").setEmail("a".repeat(330) + "@example.com").setPassword(PASSWORD).build()))
                .satisfies(e -> {
                    assertThat(code(e)).isEqualTo(Status.Code.INVALID_ARGUMENT);
                    assertThat(((StatusRuntimeException) e).getStatus().getDescription()).contains("email");
                });
        assertDatabaseCounts(0, 0);
    }

    @Test
    void invalidInputIsInvalidArgument() {
        assertThatThrownBy(() -> stub.register(RegisterRequest.newBuilder()
                .setUsername("al").setEmail("al@example.com").setPassword(PASSWORD).build()))
                .satisfies(e -> {
                    assertThat(code(e)).isEqualTo(Status.Code.INVALID_ARGUMENT);
                    assertThat(((StatusRuntimeException) e).getStatus().getDescription()).contains("username");
                });
    }

    @Test
    @DisplayName("mutations without authorization metadata are UNAUTHENTICATED")
    void mutationsRequireToken() {
        CreatePostRequest request = CreatePostRequest.newBuilder().setTitle("Hello").setContent("Body").build();

        assertThatThrownBy(() -> stub.createPost(request))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.UNAUTHENTICATED));
        assertThatThrownBy(() -> withToken("garbage").createPost(request))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.UNAUTHENTICATED));
        assertDatabaseCounts(0, 0);
    }

    @Test
    @DisplayName("register, create, get, foreign update denied, delete, then NOT_FOUND")
    void postLifecycle() {
        AuthResponse alice = register("alice");
        AuthResponse bob = register("bob");

        Post created = withToken(alice.getAccessToken())
                .createPost(CreatePostRequest.newBuilder().setTitle("Hello").setContent("First post.").build());
        assertThat(created.getAuthorId()).isEqualTo(alice.getUser().getId());
        assertThat(created.getUpdatedAt()).isEqualTo(created.getCreatedAt());

        Post fetched = stub.getPost(GetPostRequest.newBuilder().setId(created.getId()).build());
        assertThat(fetched).isEqualTo(created);

        assertThatThrownBy(() -> withToken(bob.getAccessToken()).updatePost(UpdatePostRequest.newBuilder()
                .setId(created.getId()).setTitle("Hijacked").setContent("Nope").build()))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.PERMISSION_DENIED));
        assertThat(stub.getPost(GetPostRequest.newBuilder().setId(created.getId()).build())).isEqualTo(created);

        Post updated = withToken(alice.getAccessToken()).updatePost(UpdatePostRequest.newBuilder()
                .setId(created.getId()).setTitle("Hello again").setContent("Edited.").build());
        assertThat(updated.getTitle()).isEqualTo("Hello again");

        withToken(alice.getAccessToken()).deletePost(DeletePostRequest.newBuilder().setId(created.getId()).build());

        assertThatThrownBy(() -> stub.getPost(GetPostRequest.newBuilder().setId(created.getId()).build()))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.NOT_FOUND));
    }

    @Test
    void listPostsPagination() {
        AuthResponse alice = register("alice");
        for (int i = 0; i < 5; i++) {
            withToken(alice.getAccessToken())
                    .createPost(CreatePostRequest.newBuilder().setTitle("Post " + i).setContent("c").build());
        }

        ListPostsResponse defaults = stub.listPosts(ListPostsRequest.getDefaultInstance());
        assertThat(defaults.getPage()).isEqualTo(1);
        assertThat(defaults.getPageSize()).isEqualTo(20);
        assertThat(defaults.getTotal()).isEqualTo(5);
        assertThat(defaults.getPostsCount()).isEqualTo(5);

        ListPostsResponse second = stub.listPosts(ListPostsRequest.newBuilder().setPage(2).setPageSize(2).build());
        assertThat(second.getPage()).isEqualTo(2);
        assertThat(second.getPageSize()).isEqualTo(2);
        assertThat(second.getPostsCount()).isEqualTo(2);
    }

    @Test
    void listPostsRejectsOversizedPage() {
        assertThatThrownBy(() -> stub.listPosts(ListPostsRequest.newBuilder().setPage(1).setPageSize(101).build()))
                .satisfies(e -> assertThat(code(e)).isEqualTo(Status.Code.INVALID_ARGUMENT));
    }

    private AuthResponse register(String username) {
        return stub.register(RegisterRequest.newBuilder()
                .setUsername(username)
                .setEmail(username + "@example.com")
                .setPassword(PASSWORD)
                .build());
    }

    private BlogServiceGrpc.BlogServiceBlockingStub withToken(String token) {
        Metadata headers = new Metadata();
        headers.put(GrpcAuthInterceptor.AUTHORIZATION, "Bearer " + token);
        return stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
    }

    private static Status.Code code(Throwable e) {
        return Status.fromThrowable(e).getCode();
    }
}
