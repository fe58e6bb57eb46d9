package blog.platform.controller;

import blog.platform.config.SwaggerConfig;
import blog.platform.domain.ListPostsResult;
import blog.platform.domain.Post;
import blog.platform.dto.ApiResponse;
import blog.platform.dto.CreatePostRequest;
import blog.platform.dto.ListPostsResponse;
import blog.platform.dto.PostResponse;
import blog.platform.dto.UpdatePostRequest;
import blog.platform.interceptor.RequireAuth;
import blog.platform.security.AuthenticatedUser;
import blog.platform.service.Pagination;
import blog.platform.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for posts.
 * Reads are public; mutations need a bearer token and, for update and delete, ownership.
 */
@Slf4j
@RestController
@RequestMapping("/api/posts")
@Validated
@Tag(name = "Posts", description = "Create, read, update, delete and list posts")
public class PostController {

    @Autowired
    private PostService postService;

    /**
     * List posts, newest first
     *
     * @param limit page size, 1..100, default 20
     * @param offset number of posts to skip, rounded down to a page boundary
     */
    @GetMapping
    @Operation(summary = "List posts", description = "Newest first; offset is rounded down to a multiple of limit")
    public ApiResponse<ListPostsResponse> listPosts(
            @Parameter(description = "Page size (1..100)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Number of posts to skip")
            @RequestParam(required = false) Long offset) {
        int resolvedLimit = Pagination.resolveLimit(limit);
        long resolvedOffset = Pagination.resolveOffset(offset);
        log.debug("Listing posts: limit={}, offset={}", resolvedLimit, resolvedOffset);
        ListPostsResult result = postService.list(resolvedLimit, resolvedOffset);
        return ApiResponse.success(ListPostsResponse.fromResult(result));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get post by ID")
    public ApiResponse<PostResponse> getPost(
            @Parameter(description = "Post ID", required = true)
            @PathVariable long id) {
        Post post = postService.get(id);
        return ApiResponse.success(PostResponse.fromPost(post));
    }

    @PostMapping
    @RequireAuth
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create post", security = @SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME))
    public ApiResponse<PostResponse> createPost(@Parameter(hidden = true) AuthenticatedUser user,
                                                @Valid @RequestBody CreatePostRequest request) {
        log.info("Creating post: authorId={}", user.getUserId());
        Post post = postService.create(user.getUserId(), request.getTitle(), request.getContent());
        return ApiResponse.success(201, "Post created successfully", PostResponse.fromPost(post));
    }

    /**
     * Replace title and content. Owner only.
     */
    @PutMapping("/{id}")
    @RequireAuth
    @Operation(summary = "Update post", security = @SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME))
    public ApiResponse<PostResponse> updatePost(@Parameter(hidden = true) AuthenticatedUser user,
                                                @Parameter(description = "Post ID", required = true)
                                                @PathVariable long id,
                                                @Valid @RequestBody UpdatePostRequest request) {
        log.info("Updating post: postId={}, actorId={}", id, user.getUserId());
        Post post = postService.update(user.getUserId(), id, request.getTitle(), request.getContent());
        return ApiResponse.success(PostResponse.fromPost(post));
    }

    @DeleteMapping("/{id}")
    @RequireAuth
    @Operation(summary = "Delete post", security = @SecurityRequirement(name = SwaggerConfig.BEARER_SCHEME))
    public ApiResponse<Void> deletePost(@Parameter(hidden = true) AuthenticatedUser user,
                                        @Parameter(description = "Post ID", required = true)
                                        @PathVariable long id) {
        log.info("Deleting post: postId={}, actorId={}", id, user.getUserId());
        postService.delete(user.getUserId(), id);
        return ApiResponse.success("Post deleted successfully", null);
    }
}
