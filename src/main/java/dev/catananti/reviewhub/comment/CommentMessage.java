package dev.catananti.reviewhub.comment;

import java.time.LocalDateTime;

/**
 * A comment accepted by a room. The sequence number is scoped to the room (= post).
 */
public record CommentMessage(
        Long postId,
        Long authorId,
        String text,
        long sequenceNumber,
        LocalDateTime timestamp
) {}
