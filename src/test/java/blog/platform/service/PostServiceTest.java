package blog.platform.service;

import blog.platform.domain.ListPostsResult;
import blog.platform.domain.Post;
import blog.platform.exception.ForbiddenException;
import blog.platform.exception.NotFoundException;
import blog.platform.exception.ValidationException;
import blog.platform.testutil.InMemoryPostStore;
import blog.platform.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PostServiceTest {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    private MutableClock clock;
    private InMemoryPostStore postStore;
    private SimpleMeterRegistry meterRegistry;
    private PostService postService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-15T10:30:00Z");
        postStore = new InMemoryPostStore();
        meterRegistry = new SimpleMeterRegistry();
        postService = new PostService(postStore, clock, meterRegistry);
    }

    @Test
    void createSetsOwnerAndTimestamps() {
        Post post = postService.create(ALICE, "  Hello ", " First post. ");

        assertThat(post.getId()).isPositive();
        assertThat(post.getTitle()).isEqualTo("Hello");
        assertThat(post.getContent()).isEqualTo("First post.");
        assertThat(post.getAuthorId()).isEqualTo(ALICE);
        assertThat(post.getCreatedAt()).isEqualTo(Instant.parse("2025-01-15T10:30:00Z"));
        assertThat(post.getUpdatedAt()).isEqualTo(post.getCreatedAt());
    }

    @Test
    void createValidatesInput() {
        assertThatThrownBy(() -> postService.create(ALICE, " ", "content"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("title");
        assertThatThrownBy(() -> postService.create(ALICE, "title", ""))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("content");
        assertThat(postStore.count()).isZero();
    }

    @Test
    @DisplayName("get is idempotent without intervening mutations")
    void getIsIdempotent() {
        Post created = postService.create(ALICE, "Hello", "First post.");

        assertThat(postService.get(created.getId())).isEqualTo(created);
        assertThat(postService.get(created.getId())).isEqualTo(postService.get(created.getId()));
    }

    @Test
    void getUnknownIsNotFound() {
        assertThatThrownBy(() -> postService.get(99))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> postService.get(0))
                .isInstanceOf(ValidationException.class);
    }

    @Nested
    class Update {

        @Test
        @DisplayName("owner update replaces fields and advances updated_at")
        void ownerUpdates() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            clock.advance(Duration.ofMinutes(5));

            Post updated = postService.update(ALICE, created.getId(), " Hello again ", "Edited.");

            assertThat(updated.getTitle()).isEqualTo("Hello again");
            assertThat(updated.getContent()).isEqualTo("Edited.");
            assertThat(updated.getCreatedAt()).isEqualTo(created.getCreatedAt());
            assertThat(updated.getUpdatedAt()).isEqualTo(Instant.parse("2025-01-15T10:35:00Z"));
            assertThat(postService.get(created.getId())).isEqualTo(updated);
        }

        @Test
        @DisplayName("non-owner update is forbidden and leaves the post unchanged")
        void nonOwnerForbidden() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            clock.advance(Duration.ofMinutes(5));

            assertThatThrownBy(() -> postService.update(BOB, created.getId(), "Hijacked", "Nope"))
                    .isInstanceOf(ForbiddenException.class);
            assertThat(postService.get(created.getId())).isEqualTo(created);
        }

        @Test
        void unknownPostIsNotFound() {
            assertThatThrownBy(() -> postService.update(ALICE, 42, "t", "c"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("updated_at never goes behind created_at when the clock steps back")
        void clockSkewClampsUpdatedAt() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            clock.set(created.getCreatedAt().minusSeconds(30));

            Post updated = postService.update(ALICE, created.getId(), "Hello", "Edited.");

            assertThat(updated.getUpdatedAt()).isEqualTo(created.getCreatedAt());
        }

        @Test
        @DisplayName("post deleted between lookup and update is NotFound")
        void concurrentDeleteIsNotFound() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            postStore.removeAfterNextLookup(created.getId());

            assertThatThrownBy(() -> postService.update(ALICE, created.getId(), "Hello again", "Edited."))
                    .isInstanceOf(NotFoundException.class);
            assertThat(postStore.count()).isZero();
            assertThat(meterRegistry.counter("blog.posts.mutations", "operation", "update").count()).isZero();
        }

        @Test
        void invalidPatchRejectedBeforeLookup() {
            assertThatThrownBy(() -> postService.update(ALICE, 42, "", "c"))
                    .isInstanceOf(ValidationException.class)
                    .extracting("field").isEqualTo("title");
        }
    }

    @Nested
    class Delete {

        @Test
        void ownerDeletes() {
            Post created = postService.create(ALICE, "Hello", "First post.");

            postService.delete(ALICE, created.getId());

            assertThatThrownBy(() -> postService.get(created.getId())).isInstanceOf(NotFoundException.class);
            assertThat(meterRegistry.counter("blog.posts.mutations", "operation", "delete").count()).isEqualTo(1.0);
        }

        @Test
        void nonOwnerForbiddenAndPostKept() {
            Post created = postService.create(ALICE, "Hello", "First post.");

            assertThatThrownBy(() -> postService.delete(BOB, created.getId()))
                    .isInstanceOf(ForbiddenException.class);
            assertThat(postService.get(created.getId())).isEqualTo(created);
        }

        @Test
        @DisplayName("second delete of the same post is NotFound")
        void deleteIsAppliedAtMostOnce() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            postService.delete(ALICE, created.getId());

            assertThatThrownBy(() -> postService.delete(ALICE, created.getId()))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("post deleted between lookup and delete is NotFound")
        void concurrentDeleteIsNotFound() {
            Post created = postService.create(ALICE, "Hello", "First post.");
            postStore.removeAfterNextLookup(created.getId());

            assertThatThrownBy(() -> postService.delete(ALICE, created.getId()))
                    .isInstanceOf(NotFoundException.class);
            assertThat(meterRegistry.counter("blog.posts.mutations", "operation", "delete").count()).isZero();
        }

        @Test
        void unknownPostIsNotFound() {
            assertThatThrownBy(() -> postService.delete(ALICE, 7))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class Listing {

        @Test
        @DisplayName("limit=20, offset=40 asks the store for page 3 of 20")
        void translatesOffsetToPage() {
            ListPostsResult result = postService.list(20, 40);

            assertThat(result.getPage()).isEqualTo(3);
            assertThat(result.getPageSize()).isEqualTo(20);
            assertThat(postStore.getLastPageRequest().getPage()).isEqualTo(3);
        }

        @Test
        void offsetWithinPageRoundsDown() {
            for (int i = 0; i < 25; i++) {
                postService.create(ALICE, "Post " + i, "content");
                clock.advance(Duration.ofSeconds(1));
            }

            ListPostsResult result = postService.list(10, 15);

            assertThat(result.getPage()).isEqualTo(2);
            assertThat(result.getPosts()).hasSize(10);
            // newest first: page 2 starts at the 11th newest post
            assertThat(result.getPosts().get(0).getTitle()).isEqualTo("Post 14");
            assertThat(result.getTotal()).isEqualTo(25);
        }

        @Test
        void firstPage() {
            postService.create(ALICE, "older", "content");
            clock.advance(Duration.ofSeconds(1));
            postService.create(BOB, "newer", "content");

            ListPostsResult result = postService.list(20, 0);

            assertThat(result.getPage()).isEqualTo(1);
            assertThat(result.getPosts()).extracting(Post::getTitle).containsExactly("newer", "older");
            assertThat(result.getTotal()).isEqualTo(2);
        }

        @Test
        void negativeOffsetRejected() {
            assertThatThrownBy(() -> postService.list(20, -1))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
