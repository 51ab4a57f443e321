package dev.catananti.reviewhub.event;

import java.time.LocalDateTime;

/**
 * Event produced by an accepted workflow transition.
 * The sequence number is scoped to the post and equals the post revision after the transition.
 */
public interface WorkflowEvent {

    Long postId();

    Long actorId();

    long sequenceNumber();

    LocalDateTime timestamp();
}
