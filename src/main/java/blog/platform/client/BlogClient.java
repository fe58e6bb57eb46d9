package blog.platform.client;

import blog.platform.dto.AuthResponse;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.PostResponse;

import java.util.Optional;

/**
 * Transport-neutral client for the blog API.
 * register and login remember the returned token; post mutations send it as a bearer token.
 *
 * @see HttpBlogClient
 * @see GrpcBlogClient
 */
public interface BlogClient {

    AuthResponse register(String username, String email, String password);

    AuthResponse login(String username, String password);

    /**
     * @throws BlogClientException with kind UNAUTHORIZED when no token is set
     */
    PostResponse createPost(String title, String content);

    PostResponse getPost(long id);

    PostResponse updatePost(long id, String title, String content);

    void deletePost(long id);

    /**
     * List posts newest first. The server rounds offset down to a multiple of limit.
     */
    ListPostsResponse listPosts(int limit, long offset);

    Optional<String> getToken();

    void setToken(String token);

    void clearToken();
}
