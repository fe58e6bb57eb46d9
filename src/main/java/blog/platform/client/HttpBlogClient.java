package blog.platform.client;

import blog.platform.dto.ApiResponse;
import blog.platform.dto.AuthResponse;
import blog.platform.dto.CreatePostRequest;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.LoginRequest;
import blog.platform.dto.PostResponse;
import blog.platform.dto.RegisterRequest;
import blog.platform.dto.UpdatePostRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * {@link BlogClient} over the REST API, e.g. {@code new HttpBlogClient("http://127.0.0.1:8080")}
 */
@Slf4j
public class HttpBlogClient extends AbstractBlogClient {

    private static final ParameterizedTypeReference<ApiResponse<AuthResponse>> AUTH_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private static final ParameterizedTypeReference<ApiResponse<PostResponse>> POST_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private static final ParameterizedTypeReference<ApiResponse<ListPostsResponse>> LIST_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    public HttpBlogClient(String baseUrl) {
        this(RestClient.builder().baseUrl(baseUrl).build());
    }

    public HttpBlogClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    protected AuthResponse doRegister(String username, String email, String password) {
        RegisterRequest request = RegisterRequest.builder()
                .username(username)
                .email(email)
                .password(password)
                .build();
        return call(() -> unwrap(restClient.post()
                .uri("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(AUTH_RESPONSE)));
    }

    @Override
    protected AuthResponse doLogin(String username, String password) {
        LoginRequest request = LoginRequest.builder()
                .username(username)
                .password(password)
                .build();
        return call(() -> unwrap(restClient.post()
                .uri("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(AUTH_RESPONSE)));
    }

    @Override
    protected PostResponse doCreatePost(String token, String title, String content) {
        CreatePostRequest request = CreatePostRequest.builder()
                .title(title)
                .content(content)
                .build();
        return call(() -> unwrap(restClient.post()
                .uri("/api/posts")
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(POST_RESPONSE)));
    }

    @Override
    protected PostResponse doGetPost(long id) {
        return call(() -> unwrap(restClient.get()
                .uri("/api/posts/{id}", id)
                .retrieve()
                .body(POST_RESPONSE)));
    }

    @Override
    protected PostResponse doUpdatePost(String token, long id, String title, String content) {
        UpdatePostRequest request = UpdatePostRequest.builder()
                .title(title)
                .content(content)
                .build();
        return call(() -> unwrap(restClient.put()
                .uri("/api/posts/{id}", id)
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(POST_RESPONSE)));
    }

    @Override
    protected void doDeletePost(String token, long id) {
        call(() -> restClient.delete()
                .uri("/api/posts/{id}", id)
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    protected ListPostsResponse doListPosts(int limit, long offset) {
        return call(() -> unwrap(restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/posts")
                        .queryParam("limit", limit)
                        .queryParam("offset", offset)
                        .build())
                .retrieve()
                .body(LIST_RESPONSE)));
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private static <T> T unwrap(ApiResponse<T> response) {
        if (response == null || response.getData() == null) {
            throw new BlogClientException(BlogClientException.Kind.TRANSPORT, "empty response body");
        }
        return response.getData();
    }

    private static <T> T call(Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            throw classify(e);
        } catch (RestClientException e) {
            log.debug("HTTP request failed: {}", e.getMessage());
            throw new BlogClientException(BlogClientException.Kind.TRANSPORT, e.getMessage(), e);
        }
    }

    static BlogClientException classify(RestClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        String message = status.value() + ": " + e.getResponseBodyAsString();
        BlogClientException.Kind kind;
        if (status.value() == 401 || status.value() == 403) {
            kind = BlogClientException.Kind.UNAUTHORIZED;
        } else if (status.value() == 404) {
            kind = BlogClientException.Kind.NOT_FOUND;
        } else if (status.is4xxClientError()) {
            kind = BlogClientException.Kind.INVALID_REQUEST;
        } else {
            kind = BlogClientException.Kind.TRANSPORT;
        }
        return new BlogClientException(kind, message, e);
    }
}
