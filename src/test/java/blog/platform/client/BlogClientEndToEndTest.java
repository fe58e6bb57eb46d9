package blog.platform.client;

import blog.platform.dto.AuthResponse;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.PostResponse;
import blog.platform.grpc.GrpcServerLifecycle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives both client transports against a running server
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"blog.grpc.enabled=true", "blog.grpc.port=0"})
@ActiveProfiles("test")
class BlogClientEndToEndTest {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @LocalServerPort
    private int httpPort;

    @Autowired
    private GrpcServerLifecycle grpcServer;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM posts");
        jdbcTemplate.update("DELETE FROM users");
    }

    @Test
    @DisplayName("HTTP client: only the author can change a post")
    void httpOwnershipScenario() {
        runOwnershipScenario(new HttpBlogClient("http://127.0.0.1:" + httpPort));
    }

    @Test
    @DisplayName("gRPC client: only the author can change a post")
    void grpcOwnershipScenario() {
        try (GrpcBlogClient client = GrpcBlogClient.forTarget("127.0.0.1:" + grpcServer.getPort())) {
            runOwnershipScenario(client);
        }
    }

    @Test
    void httpListingTranslatesOffset() {
        runListingScenario(new HttpBlogClient("http://127.0.0.1:" + httpPort));
    }

    @Test
    void grpcListingTranslatesOffset() {
        try (GrpcBlogClient client = GrpcBlogClient.forTarget("127.0.0.1:" + grpcServer.getPort())) {
            runListingScenario(client);
        }
    }

    @Test
    void badLoginIsUnauthorized() {
        HttpBlogClient client = new HttpBlogClient("http://127.0.0.1:" + httpPort);
        String name = uniqueName("carol");
        client.register(name, name + "@example.com", "password123");
        client.clearToken();

        assertThatThrownBy(() -> client.login(name, "wrong-password"))
                .isInstanceOf(BlogClientException.class)
                .extracting("kind").isEqualTo(BlogClientException.Kind.UNAUTHORIZED);
        assertThat(client.getToken()).isEmpty();
    }

    private void runOwnershipScenario(BlogClient client) {
        String alice = uniqueName("alice");
        String bob = uniqueName("bob");

        AuthResponse aliceAuth = client.register(alice, alice + "@example.com", "password123");
        assertThat(client.getToken()).contains(aliceAuth.getAccessToken());

        PostResponse post = client.createPost("Hello", "First post");
        assertThat(client.getPost(post.getId()).getAuthorId()).isEqualTo(aliceAuth.getUser().getId());

        client.register(bob, bob + "@example.com", "password123");
        client.login(bob, "password123");
        assertThatThrownBy(() -> client.updatePost(post.getId(), "Hijacked", "Hijacked"))
                .isInstanceOf(BlogClientException.class)
                .extracting("kind").isEqualTo(BlogClientException.Kind.UNAUTHORIZED);
        assertThatThrownBy(() -> client.deletePost(post.getId()))
                .extracting("kind").isEqualTo(BlogClientException.Kind.UNAUTHORIZED);

        client.login(alice, "password123");
        PostResponse updated = client.updatePost(post.getId(), "Hello again", "  Edited  ");
        assertThat(updated.getTitle()).isEqualTo("Hello again");
        assertThat(updated.getContent()).isEqualTo("Edited");
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(updated.getCreatedAt());

        client.deletePost(post.getId());
        assertThatThrownBy(() -> client.getPost(post.getId()))
                .extracting("kind").isEqualTo(BlogClientException.Kind.NOT_FOUND);
    }

    private void runListingScenario(BlogClient client) {
        String author = uniqueName("dave");
        client.register(author, author + "@example.com", "password123");
        for (int i = 1; i <= 5; i++) {
            client.createPost("Post " + i, "content " + i);
        }

        ListPostsResponse page = client.listPosts(2, 3);

        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.getLimit()).isEqualTo(2);
        assertThat(page.getOffset()).isEqualTo(2);
        assertThat(page.getPosts()).extracting(PostResponse::getTitle).containsExactly("Post 3", "Post 2");
    }

    private static String uniqueName(String prefix) {
        return prefix + "_" + SEQUENCE.incrementAndGet();
    }
}
