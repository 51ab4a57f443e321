package dev.catananti.reviewhub.repository;

import dev.catananti.reviewhub.entity.Post;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PostRepository extends ReactiveCrudRepository<Post, Long> {

    /**
     * Conditional status update guarded by both status and revision.
     * Returns the number of rows changed: 1 when this caller won, 0 when the row moved on.
     */
    @Modifying
    @Query("UPDATE posts SET status = :next, revision = revision + 1, reviewer_id = :reviewerId, "
            + "rejection_reason = :reason, updated_at = :updatedAt "
            + "WHERE id = :id AND status = :expected AND revision = :revision")
    Mono<Integer> compareAndSetStatus(Long id, String expected, Long revision, String next,
                                      Long reviewerId, String reason, LocalDateTime updatedAt);

    @Query("SELECT id FROM posts WHERE status = 'PENDING' ORDER BY updated_at ASC")
    Flux<Long> findPendingIds();

    Flux<Post> findByStatusOrderByUpdatedAtDesc(String status);

    Flux<Post> findByAuthorIdOrderByCreatedAtDesc(Long authorId);

    /**
     * Replaces title and content while the post is still with its author or waiting for review.
     * Leaves status and revision alone. Returns 0 if the post has been decided in the meantime.
     */
    @Modifying
    @Query("UPDATE posts SET title = :title, content = :content, updated_at = :updatedAt "
            + "WHERE id = :id AND author_id = :authorId AND status IN ('DRAFT', 'PENDING')")
    Mono<Integer> updateContentIfEditable(Long id, Long authorId, String title, String content,
                                          LocalDateTime updatedAt);
}
