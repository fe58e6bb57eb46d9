package blog.platform.store;

import blog.platform.domain.NewPost;
import blog.platform.domain.PageRequest;
import blog.platform.domain.Post;
import blog.platform.domain.PostPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for posts.
 *
 * Mutations are single conditional statements guarded by both id and author_id,
 * so a non-owner or an already-deleted post simply matches no row.
 */
public interface PostStore {

    /**
     * @throws blog.platform.exception.NotFoundException when the author does not exist
     */
    Post create(NewPost newPost);

    Optional<Post> findById(long id);

    /**
     * @return the updated post, or empty if no row matched id and owner
     */
    Optional<Post> updateOwned(long postId, long ownerId, PostPatch patch, Instant updatedAt);

    /**
     * @return true if a row matching id and owner was deleted
     */
    boolean deleteOwned(long postId, long ownerId);

    /**
     * Ordered by created_at descending, then id descending
     */
    List<Post> list(PageRequest pageRequest);

    long count();
}
