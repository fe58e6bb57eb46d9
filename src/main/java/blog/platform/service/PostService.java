package blog.platform.service;

import blog.platform.domain.ListPostsResult;
import blog.platform.domain.NewPost;
import blog.platform.domain.Normalizer;
import blog.platform.domain.PageRequest;
import blog.platform.domain.Post;
import blog.platform.domain.PostPatch;
import blog.platform.exception.ForbiddenException;
import blog.platform.exception.NotFoundException;
import blog.platform.store.PostStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Post CRUD with ownership enforcement.
 *
 * Update and delete share one policy: fetch to tell NotFound from Forbidden,
 * then run a mutation guarded by id and author_id. A concurrent delete between
 * the two steps matches no row and is reported as NotFound.
 */
@Slf4j
@Service
public class PostService {

    private final PostStore postStore;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public PostService(PostStore postStore, Clock clock, MeterRegistry meterRegistry) {
        this.postStore = postStore;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Create a post owned by authorId
     */
    public Post create(long authorId, String title, String content) {
        Normalizer.positive("author_id", authorId);
        NewPost newPost = new NewPost(Normalizer.title(title), Normalizer.content(content), authorId, now());

        Post post = postStore.create(newPost);
        meterRegistry.counter("blog.posts.mutations", "operation", "create").increment();
        log.info("Post created: postId={}, authorId={}", post.getId(), authorId);
        return post;
    }

    /**
     * Get post by ID
     *
     * @throws NotFoundException if the post does not exist
     */
    public Post get(long id) {
        Normalizer.positive("id", id);
        log.debug("Getting post: postId={}", id);
        return postStore.findById(id).orElseThrow(() -> notFound(id));
    }

    /**
     * Replace title and content of a post owned by actorId
     *
     * @throws NotFoundException  if the post does not exist (or vanished concurrently)
     * @throws ForbiddenException if actorId is not the owner; the post is left untouched
     */
    public Post update(long actorId, long postId, String title, String content) {
        Normalizer.positive("id", postId);
        PostPatch patch = new PostPatch(Normalizer.title(title), Normalizer.content(content));

        Post existing = requireOwned(actorId, postId);
        Instant now = now();
        Instant updatedAt = now.isBefore(existing.getCreatedAt()) ? existing.getCreatedAt() : now;

        Post updated = postStore.updateOwned(postId, actorId, patch, updatedAt)
                .orElseThrow(() -> notFound(postId));
        meterRegistry.counter("blog.posts.mutations", "operation", "update").increment();
        log.info("Post updated: postId={}, actorId={}", postId, actorId);
        return updated;
    }

    /**
     * Delete a post owned by actorId
     *
     * @throws NotFoundException  if the post does not exist (or vanished concurrently)
     * @throws ForbiddenException if actorId is not the owner; the post is left untouched
     */
    public void delete(long actorId, long postId) {
        Normalizer.positive("id", postId);
        requireOwned(actorId, postId);

        if (!postStore.deleteOwned(postId, actorId)) {
            throw notFound(postId);
        }
        meterRegistry.counter("blog.posts.mutations", "operation", "delete").increment();
        log.info("Post deleted: postId={}, actorId={}", postId, actorId);
    }

    /**
     * List posts newest first.
     * limit/offset are translated to the page containing offset, see {@link Pagination#toPage}.
     */
    public ListPostsResult list(int limit, long offset) {
        PageRequest pageRequest = Pagination.toPage(limit, offset);
        List<Post> posts = postStore.list(pageRequest);
        long total = postStore.count();
        log.debug("Listed posts: page={}, pageSize={}, returned={}, total={}",
                pageRequest.getPage(), pageRequest.getPageSize(), posts.size(), total);
        return new ListPostsResult(posts, pageRequest.getPage(), pageRequest.getPageSize(), total);
    }

    /**
     * Current time at the precision the store keeps
     */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private Post requireOwned(long actorId, long postId) {
        Post post = postStore.findById(postId).orElseThrow(() -> notFound(postId));
        if (!post.isOwnedBy(actorId)) {
            log.warn("Forbidden mutation: postId={}, actorId={}, ownerId={}", postId, actorId, post.getAuthorId());
            throw new ForbiddenException();
        }
        return post;
    }

    private static NotFoundException notFound(long postId) {
        return new NotFoundException("post id: " + postId);
    }
}
