package blog.platform.client;

import blog.platform.dto.AuthResponse;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.PostResponse;

import java.util.Optional;

/**
 * Token bookkeeping shared by the transports.
 * Subclasses implement the wire calls; the token is passed in explicitly for protected ones.
 */
public abstract class AbstractBlogClient implements BlogClient {

    private volatile String token;

    @Override
    public AuthResponse register(String username, String email, String password) {
        AuthResponse response = doRegister(username, email, password);
        this.token = response.getAccessToken();
        return response;
    }

    @Override
    public AuthResponse login(String username, String password) {
        AuthResponse response = doLogin(username, password);
        this.token = response.getAccessToken();
        return response;
    }

    @Override
    public PostResponse createPost(String title, String content) {
        return doCreatePost(requireToken(), title, content);
    }

    @Override
    public PostResponse getPost(long id) {
        return doGetPost(id);
    }

    @Override
    public PostResponse updatePost(long id, String title, String content) {
        return doUpdatePost(requireToken(), id, title, content);
    }

    @Override
    public void deletePost(long id) {
        doDeletePost(requireToken(), id);
    }

    @Override
    public ListPostsResponse listPosts(int limit, long offset) {
        return doListPosts(limit, offset);
    }

    @Override
    public Optional<String> getToken() {
        return Optional.ofNullable(token);
    }

    @Override
    public void setToken(String token) {
        this.token = token;
    }

    @Override
    public void clearToken() {
        this.token = null;
    }

    private String requireToken() {
        String current = token;
        if (current == null || current.isEmpty()) {
            throw new BlogClientException(BlogClientException.Kind.UNAUTHORIZED, "not logged in");
        }
        return current;
    }

    protected abstract AuthResponse doRegister(String username, String email, String password);

    protected abstract AuthResponse doLogin(String username, String password);

    protected abstract PostResponse doCreatePost(String token, String title, String content);

    protected abstract PostResponse doGetPost(long id);

    protected abstract PostResponse doUpdatePost(String token, long id, String title, String content);

    protected abstract void doDeletePost(String token, long id);

    protected abstract ListPostsResponse doListPosts(int limit, long offset);
}
