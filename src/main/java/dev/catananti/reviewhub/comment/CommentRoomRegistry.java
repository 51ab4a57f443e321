package dev.catananti.reviewhub.comment;

import dev.catananti.reviewhub.config.RealtimeProperties;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.event.SubscriberOverflowException;
import dev.catananti.reviewhub.event.Topic;
import dev.catananti.reviewhub.exception.ConnectionRejectedException;
import dev.catananti.reviewhub.exception.InvalidInputException;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Per-post live comment rooms.
 * <p>
 * Membership changes, sequence assignment and every emit to a room's members run under the room's
 * monitor, so all members of a room see the same order. Different rooms never contend.
 * A member whose outbound queue is full is evicted and the rest of the room is told it left.
 */
@Component
@Slf4j
public class CommentRoomRegistry {

    private final EventBus eventBus;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final int queueDepth;
    private final int replaySize;
    private final int maxTextLength;
    private final int maxMembers;
    private final Duration gracePeriod;
    private final Duration flushDeadline;

    private final Map<Long, Room> rooms = new ConcurrentHashMap<>();
    private final Map<String, Long> memberIndex = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();
    private volatile boolean accepting = true;

    public CommentRoomRegistry(EventBus eventBus, RealtimeMetrics metrics, Clock clock, RealtimeProperties properties) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.queueDepth = properties.getCommentQueueDepth();
        this.replaySize = properties.getReplaySize();
        this.maxTextLength = properties.getMaxCommentLength();
        this.maxMembers = properties.getMaxRoomMembers();
        this.gracePeriod = properties.getRoomGracePeriod();
        this.flushDeadline = properties.getShutdownFlushDeadline();
    }

    /**
     * Join a post's room. The returned stream starts with the buffered comments, followed by the
     * joiner's own JOINED notice and then live traffic. Cancelling the stream leaves the room.
     */
    public Flux<RoomMessage> join(Long postId, String connectionId, Long viewerId) {
        synchronized (registrationLock) {
            if (!accepting) {
                return Flux.error(new ConnectionRejectedException("Comment rooms are shutting down"));
            }
            if (memberIndex.size() >= maxMembers) {
                log.warn("Rejected join of {} to post {}: member limit {} reached", connectionId, postId, maxMembers);
                return Flux.error(new ConnectionRejectedException("Comment room capacity reached"));
            }
            if (memberIndex.putIfAbsent(connectionId, postId) != null) {
                return Flux.error(new IllegalStateException("Connection already joined: " + connectionId));
            }
        }

        RoomMember member = new RoomMember(connectionId, viewerId, queueDepth);
        withRoom(postId, room -> {
            for (CommentMessage buffered : room.replay()) {
                member.sink.tryEmitNext(RoomMessage.comment(buffered));
            }
            room.members.put(connectionId, member);
            room.emptySince = null;
            broadcast(room, RoomMessage.presence(RoomMessageType.JOINED, postId, viewerId, room.lastSequence, now()));
            return room;
        });
        log.debug("Viewer {} joined room {} as {}", viewerId, postId, connectionId);

        return member.sink.asFlux()
                .takeUntilOther(member.kill.asMono())
                .doFinally(signal -> {
                    member.released.tryEmitEmpty();
                    leave(postId, connectionId);
                });
    }

    /**
     * Accept a comment into the room, broadcast it to every member and hand it to the archiver.
     *
     * @throws InvalidInputException if the text is blank or too long
     */
    public CommentMessage post(Long postId, Long authorId, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Comment text must not be blank");
        }
        if (text.length() > maxTextLength) {
            throw new InvalidInputException("Comment text exceeds " + maxTextLength + " characters");
        }
        if (!accepting) {
            throw new ConnectionRejectedException("Comment rooms are shutting down");
        }

        CommentMessage message = withRoom(postId, room -> {
            room.lastSequence++;
            CommentMessage accepted = new CommentMessage(postId, authorId, text, room.lastSequence, now());
            room.remember(accepted);
            broadcast(room, RoomMessage.comment(accepted));
            // Still under the room monitor so the archive topic sees this room's sequence order
            try {
                eventBus.publish(Topic.COMMENTS, accepted);
            } catch (IllegalStateException e) {
                log.warn("DeliveryDegraded: comment {}#{} not archived: {}", postId, accepted.sequenceNumber(), e.getMessage());
                metrics.incrementDeliveryDropped(RealtimeMetrics.HUB_BUS, 1);
            }
            return accepted;
        });
        metrics.incrementCommentPosted();
        log.debug("Comment {}#{} posted by {}", postId, message.sequenceNumber(), authorId);
        return message;
    }

    /**
     * Remove a member from a room. Safe to call more than once.
     */
    public void leave(Long postId, String connectionId) {
        if (depart(postId, connectionId) != null) {
            log.debug("Connection {} left room {}", connectionId, postId);
        }
    }

    /**
     * Force a connection out of whichever room it is in. Its stream ends at once, even if it
     * still has unread messages queued.
     *
     * @return {@code false} if the connection is not a member of any room
     */
    public boolean disconnect(String connectionId) {
        Long postId = memberIndex.get(connectionId);
        if (postId == null) {
            return false;
        }
        RoomMember member = depart(postId, connectionId);
        if (member != null) {
            member.kill.tryEmitValue(Boolean.TRUE);
            log.info("Connection {} forced out of room {}", connectionId, postId);
        }
        return true;
    }

    /**
     * Close a post's room for good, typically because the post is gone. Members get SHUTDOWN
     * and are cut off if they have not drained by the flush deadline. The replay buffer goes
     * with the room.
     */
    public Mono<Void> closeRoom(Long postId) {
        Room room = rooms.get(postId);
        if (room == null) {
            return Mono.empty();
        }
        List<RoomMember> closing;
        synchronized (room) {
            closing = retire(room);
        }
        log.info("Closed comment room {} with {} members", postId, closing.size());
        return drain(closing, "Comment room " + postId);
    }

    /**
     * Send an ERROR frame to one member only.
     */
    public void reject(Long postId, String connectionId, String reason) {
        Room room = rooms.get(postId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            RoomMember member = room.members.get(connectionId);
            if (member == null) {
                return;
            }
            Sinks.EmitResult result = member.sink.tryEmitNext(RoomMessage.error(postId, reason, room.lastSequence, now()));
            if (result.isFailure()) {
                evict(room, member, result);
                announceDepartures(room, List.of(member));
            }
        }
    }

    /**
     * Retire rooms that have been empty for longer than the grace period.
     *
     * @return the number of rooms removed
     */
    public int sweepEmptyRooms() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        int removed = 0;
        for (Room room : rooms.values()) {
            synchronized (room) {
                if (room.members.isEmpty() && room.emptySince != null && !room.emptySince.isAfter(cutoff)) {
                    room.retired = true;
                    rooms.remove(room.postId, room);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Retired {} empty comment rooms", removed);
        }
        return removed;
    }

    public void stopAccepting() {
        synchronized (registrationLock) {
            accepting = false;
        }
    }

    /**
     * Send SHUTDOWN to every member and complete their streams. Members that have not drained
     * by the deadline are cut off.
     */
    public Mono<Void> shutdown(Duration flushDeadline) {
        stopAccepting();
        List<RoomMember> closing = new ArrayList<>();
        for (Room room : rooms.values()) {
            synchronized (room) {
                closing.addAll(retire(room));
            }
        }
        log.info("Closing {} comment room members", closing.size());
        return drain(closing, flushDeadline, "Comment rooms");
    }

    public List<RoomStats> roomStats() {
        List<RoomStats> stats = new ArrayList<>();
        for (Room room : rooms.values()) {
            synchronized (room) {
                stats.add(new RoomStats(room.postId, room.members.size(), room.lastSequence));
            }
        }
        stats.sort(Comparator.comparing(RoomStats::postId));
        return stats;
    }

    public int memberCount() {
        return memberIndex.size();
    }

    public int roomCount() {
        return rooms.size();
    }

    private RoomMember depart(Long postId, String connectionId) {
        Room room = rooms.get(postId);
        if (room == null) {
            memberIndex.remove(connectionId, postId);
            return null;
        }
        synchronized (room) {
            RoomMember member = room.members.remove(connectionId);
            if (member == null) {
                return null;
            }
            memberIndex.remove(connectionId, postId);
            member.sink.tryEmitComplete();
            if (room.members.isEmpty()) {
                room.emptySince = clock.instant();
            } else {
                broadcast(room, RoomMessage.presence(RoomMessageType.LEFT, postId, member.viewerId, room.lastSequence, now()));
            }
            return member;
        }
    }

    // Caller holds the room monitor
    private List<RoomMember> retire(Room room) {
        List<RoomMember> members = List.copyOf(room.members.values());
        room.members.clear();
        room.retired = true;
        rooms.remove(room.postId, room);
        for (RoomMember member : members) {
            memberIndex.remove(member.connectionId, room.postId);
            member.sink.tryEmitNext(RoomMessage.shutdown(room.postId, room.lastSequence, now()));
            member.sink.tryEmitComplete();
        }
        return members;
    }

    private Mono<Void> drain(List<RoomMember> closing, String scope) {
        return drain(closing, flushDeadline, scope);
    }

    private Mono<Void> drain(List<RoomMember> closing, Duration deadline, String scope) {
        if (closing.isEmpty()) {
            return Mono.empty();
        }
        return Mono.when(closing.stream().map(member -> member.released.asMono()).toList())
                .timeout(deadline)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("{}: flush deadline of {} exceeded, forcing close of {} members", scope, deadline, closing.size());
                    closing.forEach(member -> member.kill.tryEmitValue(Boolean.TRUE));
                    return Mono.empty();
                });
    }

    private <R> R withRoom(Long postId, Function<Room, R> action) {
        while (true) {
            Room room = rooms.computeIfAbsent(postId, id -> new Room(id, replaySize, clock.instant()));
            synchronized (room) {
                // A retired room is already out of the map; the next lookup creates a fresh one
                if (!room.retired) {
                    return action.apply(room);
                }
            }
        }
    }

    // Caller holds the room monitor
    private void broadcast(Room room, RoomMessage message) {
        List<RoomMember> departed = deliver(room, message);
        announceDepartures(room, departed);
    }

    // Caller holds the room monitor. Members lost while announcing are not announced again.
    private void announceDepartures(Room room, List<RoomMember> departed) {
        for (RoomMember gone : departed) {
            if (room.members.isEmpty()) {
                break;
            }
            deliver(room, RoomMessage.presence(RoomMessageType.LEFT, room.postId, gone.viewerId, room.lastSequence, now()));
        }
        if (room.members.isEmpty() && room.emptySince == null) {
            room.emptySince = clock.instant();
        }
    }

    private List<RoomMember> deliver(Room room, RoomMessage message) {
        List<RoomMember> departed = null;
        for (RoomMember member : List.copyOf(room.members.values())) {
            Sinks.EmitResult result = member.sink.tryEmitNext(message);
            if (result.isFailure()) {
                evict(room, member, result);
                if (departed == null) {
                    departed = new ArrayList<>();
                }
                departed.add(member);
            }
        }
        return departed == null ? List.of() : departed;
    }

    private void evict(Room room, RoomMember member, Sinks.EmitResult result) {
        room.members.remove(member.connectionId);
        memberIndex.remove(member.connectionId, room.postId);
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("DeliveryDegraded: evicting {} from room {}, outbound queue of {} is full",
                    member.connectionId, room.postId, queueDepth);
            metrics.incrementDeliveryDropped(RealtimeMetrics.HUB_COMMENTS, 1);
            member.sink.tryEmitError(new SubscriberOverflowException("comments:" + room.postId, queueDepth));
        } else {
            log.debug("Dropping {} from room {}: {}", member.connectionId, room.postId, result);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
