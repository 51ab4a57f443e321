package dev.catananti.reviewhub.comment;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one post's comment room. Every field is guarded by the room's monitor.
 */
final class Room {

    final Long postId;
    final Map<String, RoomMember> members = new LinkedHashMap<>();
    long lastSequence;
    Instant emptySince;
    boolean retired;

    private final int replaySize;
    private final Deque<CommentMessage> replay = new ArrayDeque<>();

    Room(Long postId, int replaySize, Instant createdAt) {
        this.postId = postId;
        this.replaySize = replaySize;
        this.emptySince = createdAt;
    }

    void remember(CommentMessage message) {
        if (replaySize == 0) {
            return;
        }
        replay.addLast(message);
        while (replay.size() > replaySize) {
            replay.removeFirst();
        }
    }

    List<CommentMessage> replay() {
        return List.copyOf(replay);
    }
}
