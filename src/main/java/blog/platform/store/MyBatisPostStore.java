package blog.platform.store;

import blog.platform.domain.NewPost;
import blog.platform.domain.PageRequest;
import blog.platform.domain.Post;
import blog.platform.domain.PostPatch;
import blog.platform.exception.NotFoundException;
import blog.platform.exception.UnexpectedException;
import blog.platform.exception.ValidationException;
import blog.platform.mapper.PostMapper;
import blog.platform.mapper.PostRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Relational {@link PostStore} backed by MyBatis
 */
@Slf4j
@Repository
public class MyBatisPostStore implements PostStore {

    private final PostMapper postMapper;

    public MyBatisPostStore(PostMapper postMapper) {
        this.postMapper = postMapper;
    }

    @Override
    public Post create(NewPost newPost) {
        PostRow row = PostRow.builder()
                .title(newPost.getTitle())
                .content(newPost.getContent())
                .authorId(newPost.getAuthorId())
                .createdAt(newPost.getCreatedAt())
                .updatedAt(newPost.getCreatedAt())
                .build();
        try {
            postMapper.insert(row);
        } catch (DataIntegrityViolationException e) {
            // only the author foreign key can fail on a validated insert
            throw new NotFoundException("author");
        } catch (DataAccessException e) {
            throw new UnexpectedException("insert post failed", e);
        }
        if (row.getId() == null) {
            throw new UnexpectedException("insert post returned no id");
        }
        return toPost(row);
    }

    @Override
    public Optional<Post> findById(long id) {
        return Optional.ofNullable(execute("find post", () -> postMapper.findById(id))).map(this::toPost);
    }

    @Override
    @Transactional
    public Optional<Post> updateOwned(long postId, long ownerId, PostPatch patch, Instant updatedAt) {
        int updated = execute("update post", () ->
                postMapper.updateOwned(postId, ownerId, patch.getTitle(), patch.getContent(), updatedAt));
        if (updated == 0) {
            return Optional.empty();
        }
        return findById(postId);
    }

    @Override
    public boolean deleteOwned(long postId, long ownerId) {
        return execute("delete post", () -> postMapper.deleteOwned(postId, ownerId)) > 0;
    }

    @Override
    public List<Post> list(PageRequest pageRequest) {
        List<PostRow> rows = execute("list posts", () ->
                postMapper.findPage(pageRequest.offset(), pageRequest.getPageSize()));
        return rows.stream().map(this::toPost).collect(Collectors.toList());
    }

    @Override
    public long count() {
        return execute("count posts", postMapper::countAll);
    }

    private <T> T execute(String operation, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DataAccessException e) {
            throw new UnexpectedException(operation + " failed", e);
        }
    }

    private Post toPost(PostRow row) {
        try {
            return Post.of(row.getId(), row.getTitle(), row.getContent(), row.getAuthorId(),
                    row.getCreatedAt(), row.getUpdatedAt());
        } catch (ValidationException | NullPointerException e) {
            log.error("Stored post violates invariants: id={}", row.getId());
            throw new UnexpectedException("invalid post row " + row.getId(), e);
        }
    }
}
