package dev.catananti.reviewhub.event;

import java.time.LocalDateTime;

/**
 * A post entered the pending queue, either for the first time or after a rejection.
 */
public record SubmittedEvent(
        Long postId,
        Long authorId,
        boolean resubmission,
        long sequenceNumber,
        LocalDateTime timestamp
) implements WorkflowEvent {

    @Override
    public Long actorId() {
        return authorId;
    }
}
