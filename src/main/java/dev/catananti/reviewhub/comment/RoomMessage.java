package dev.catananti.reviewhub.comment;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Outbound frame of a comment room. {@code text} carries the comment body for COMMENT
 * and the reason for ERROR frames. Presence frames carry the room's current sequence number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomMessage(
        RoomMessageType type,
        Long postId,
        Long author,
        String text,
        long sequenceNumber,
        LocalDateTime timestamp
) {

    static RoomMessage comment(CommentMessage message) {
        return new RoomMessage(RoomMessageType.COMMENT, message.postId(), message.authorId(),
                message.text(), message.sequenceNumber(), message.timestamp());
    }

    static RoomMessage presence(RoomMessageType type, Long postId, Long viewerId, long sequenceNumber,
                                LocalDateTime timestamp) {
        return new RoomMessage(type, postId, viewerId, null, sequenceNumber, timestamp);
    }

    static RoomMessage error(Long postId, String reason, long sequenceNumber, LocalDateTime timestamp) {
        return new RoomMessage(RoomMessageType.ERROR, postId, null, reason, sequenceNumber, timestamp);
    }

    static RoomMessage shutdown(Long postId, long sequenceNumber, LocalDateTime timestamp) {
        return new RoomMessage(RoomMessageType.SHUTDOWN, postId, null, null, sequenceNumber, timestamp);
    }
}
