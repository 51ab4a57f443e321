package dev.catananti.reviewhub.event;

import java.time.LocalDateTime;

/**
 * A reviewer decided a pending post. Created once per accepted decision and never mutated.
 */
public record ApprovalEvent(
        Long postId,
        Long reviewerId,
        Decision decision,
        String reason,
        long sequenceNumber,
        LocalDateTime timestamp
) implements WorkflowEvent {

    @Override
    public Long actorId() {
        return reviewerId;
    }
}
