package blog.platform.client;

import blog.platform.domain.PageRequest;
import blog.platform.dto.AuthResponse;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.PostResponse;
import blog.platform.dto.UserResponse;
import blog.platform.grpc.proto.BlogServiceGrpc;
import blog.platform.grpc.proto.CreatePostRequest;
import blog.platform.grpc.proto.DeletePostRequest;
import blog.platform.grpc.proto.GetPostRequest;
import blog.platform.grpc.proto.ListPostsRequest;
import blog.platform.grpc.proto.LoginRequest;
import blog.platform.grpc.proto.RegisterRequest;
import blog.platform.grpc.proto.UpdatePostRequest;
import blog.platform.service.Pagination;
import com.google.protobuf.Timestamp;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link BlogClient} over gRPC.
 * Translates the client's limit/offset into the service's page/page_size.
 */
@Slf4j
public class GrpcBlogClient extends AbstractBlogClient implements Closeable {

    private static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final ManagedChannel channel;

    private final boolean ownsChannel;

    private final BlogServiceGrpc.BlogServiceBlockingStub stub;

    /**
     * Plaintext client for a target such as {@code 127.0.0.1:50051}
     */
    public static GrpcBlogClient forTarget(String target) {
        return new GrpcBlogClient(ManagedChannelBuilder.forTarget(target).usePlaintext().build(), true);
    }

    /**
     * Client over a caller-managed channel; {@link #close()} leaves the channel open
     */
    public GrpcBlogClient(ManagedChannel channel) {
        this(channel, false);
    }

    private GrpcBlogClient(ManagedChannel channel, boolean ownsChannel) {
        this.channel = channel;
        this.ownsChannel = ownsChannel;
        this.stub = BlogServiceGrpc.newBlockingStub(channel);
    }

    @Override
    protected AuthResponse doRegister(String username, String email, String password) {
        RegisterRequest request = RegisterRequest.newBuilder()
                .setUsername(username)
                .setEmail(email)
                .setPassword(password)
                .build();
        return call(() -> toAuthResponse(stub.register(request)));
    }

    @Override
    protected AuthResponse doLogin(String username, String password) {
        LoginRequest request = LoginRequest.newBuilder()
                .setUsername(username)
                .setPassword(password)
                .build();
        return call(() -> toAuthResponse(stub.login(request)));
    }

    @Override
    protected PostResponse doCreatePost(String token, String title, String content) {
        CreatePostRequest request = CreatePostRequest.newBuilder()
                .setTitle(title)
                .setContent(content)
                .build();
        return call(() -> toPostResponse(authorized(token).createPost(request)));
    }

    @Override
    protected PostResponse doGetPost(long id) {
        return call(() -> toPostResponse(stub.getPost(GetPostRequest.newBuilder().setId(id).build())));
    }

    @Override
    protected PostResponse doUpdatePost(String token, long id, String title, String content) {
        UpdatePostRequest request = UpdatePostRequest.newBuilder()
                .setId(id)
                .setTitle(title)
                .setContent(content)
                .build();
        return call(() -> toPostResponse(authorized(token).updatePost(request)));
    }

    @Override
    protected void doDeletePost(String token, long id) {
        call(() -> authorized(token).deletePost(DeletePostRequest.newBuilder().setId(id).build()));
    }

    /**
     * limit <= 0 asks for the first page at the server's default page size
     */
    @Override
    protected ListPostsResponse doListPosts(int limit, long offset) {
        ListPostsRequest.Builder request = ListPostsRequest.newBuilder();
        if (limit > 0) {
            PageRequest page = Pagination.toPage(limit, offset);
            request.setPage(page.getPage()).setPageSize(page.getPageSize());
        }
        blog.platform.grpc.proto.ListPostsResponse response = call(() -> stub.listPosts(request.build()));

        PageRequest served = new PageRequest(response.getPage(), response.getPageSize());
        return ListPostsResponse.builder()
                .posts(response.getPostsList().stream().map(GrpcBlogClient::toPostResponse).collect(Collectors.toList()))
                .limit(response.getPageSize())
                .offset(Pagination.toOffset(served))
                .total(response.getTotal())
                .build();
    }

    @Override
    public void close() {
        if (!ownsChannel) {
            return;
        }
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
        }
    }

    private BlogServiceGrpc.BlogServiceBlockingStub authorized(String token) {
        Metadata headers = new Metadata();
        headers.put(AUTHORIZATION, "Bearer " + token);
        return stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
    }

    private static <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (StatusRuntimeException e) {
            throw classify(e);
        }
    }

    static BlogClientException classify(StatusRuntimeException e) {
        BlogClientException.Kind kind;
        switch (e.getStatus().getCode()) {
            case UNAUTHENTICATED:
            case PERMISSION_DENIED:
                kind = BlogClientException.Kind.UNAUTHORIZED;
                break;
            case NOT_FOUND:
                kind = BlogClientException.Kind.NOT_FOUND;
                break;
            case INVALID_ARGUMENT:
            case ALREADY_EXISTS:
            case FAILED_PRECONDITION:
                kind = BlogClientException.Kind.INVALID_REQUEST;
                break;
            default:
                log.debug("gRPC call failed: {}", e.getStatus());
                kind = BlogClientException.Kind.TRANSPORT;
        }
        return new BlogClientException(kind, e.getStatus().getCode() + ": " + e.getStatus().getDescription(), e);
    }

    private static AuthResponse toAuthResponse(blog.platform.grpc.proto.AuthResponse response) {
        blog.platform.grpc.proto.User user = response.getUser();
        return AuthResponse.builder()
                .accessToken(response.getAccessToken())
                .user(UserResponse.builder()
                        .id(user.getId())
                        .username(user.getUsername())
                        .email(user.getEmail())
                        .createdAt(toInstant(user.getCreatedAt()))
                        .build())
                .build();
    }

    private static PostResponse toPostResponse(blog.platform.grpc.proto.Post post) {
        return PostResponse.builder()
                .id(post.getId())
                .title(post.getTitle())
                .content(post.getContent())
                .authorId(post.getAuthorId())
                .createdAt(toInstant(post.getCreatedAt()))
                .updatedAt(toInstant(post.getUpdatedAt()))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
