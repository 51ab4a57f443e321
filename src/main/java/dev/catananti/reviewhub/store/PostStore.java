package dev.catananti.reviewhub.store;

import dev.catananti.reviewhub.comment.CommentMessage;
import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.event.ApprovalEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable side of the review workflow.
 */
public interface PostStore {

    /**
     * @return the current snapshot, or empty if the post does not exist
     */
    Mono<PostSnapshot> getPost(Long postId);

    /**
     * Move the post to {@code next} only if it still has the status and revision of {@code expected}.
     * A successful swap increments the revision.
     *
     * @return {@code true} if this call performed the swap
     */
    Mono<Boolean> compareAndSetStatus(PostSnapshot expected, PostStatus next, Long reviewerId, String reason);

    Mono<Void> appendApprovalEvent(ApprovalEvent event);

    Mono<Void> appendComment(CommentMessage message);

    /**
     * Ids of posts awaiting review, oldest submission first.
     */
    Flux<Long> findPendingPostIds();
}
