package blog.platform.grpc;

import blog.platform.domain.AuthResult;
import blog.platform.domain.ListPostsResult;
import blog.platform.grpc.proto.AuthResponse;
import blog.platform.grpc.proto.ListPostsResponse;
import com.google.protobuf.Timestamp;

import java.time.Instant;

/**
 * Domain to protobuf conversions
 */
final class GrpcMappers {

    private GrpcMappers() {
    }

    static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    static blog.platform.grpc.proto.User toProto(blog.platform.domain.User user) {
        return blog.platform.grpc.proto.User.newBuilder()
                .setId(user.getId())
                .setUsername(user.getUsername())
                .setEmail(user.getEmail())
                .setCreatedAt(toTimestamp(user.getCreatedAt()))
                .build();
    }

    static blog.platform.grpc.proto.Post toProto(blog.platform.domain.Post post) {
        return blog.platform.grpc.proto.Post.newBuilder()
                .setId(post.getId())
                .setTitle(post.getTitle())
                .setContent(post.getContent())
                .setAuthorId(post.getAuthorId())
                .setCreatedAt(toTimestamp(post.getCreatedAt()))
                .setUpdatedAt(toTimestamp(post.getUpdatedAt()))
                .build();
    }

    static AuthResponse toProto(AuthResult result) {
        return AuthResponse.newBuilder()
                .setAccessToken(result.getAccessToken())
                .setUser(toProto(result.getUser()))
                .build();
    }

    static ListPostsResponse toProto(ListPostsResult result) {
        ListPostsResponse.Builder builder = ListPostsResponse.newBuilder()
                .setPage(result.getPage())
                .setPageSize(result.getPageSize())
                .setTotal(Math.max(0, result.getTotal()));
        result.getPosts().forEach(post -> builder.addPosts(toProto(post)));
        return builder.build();
    }
}
