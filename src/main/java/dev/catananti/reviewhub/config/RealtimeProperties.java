package dev.catananti.reviewhub.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the event bus, the notification hub and the comment rooms.
 * Queue depths are rounded up to the next power of two by the underlying queues.
 */
@Component
@Getter
@Slf4j
public class RealtimeProperties {

    private final int busSubscriberBuffer;

    private final int notificationQueueDepth;
    private final int maxNotificationConnections;
    private final Duration heartbeatInterval;
    private final Duration idleTimeout;
    private final int historySize;
    private final long historyMaxPosts;

    private final int commentQueueDepth;
    private final int replaySize;
    private final int maxCommentLength;
    private final int maxRoomMembers;
    private final Duration roomGracePeriod;

    private final Duration shutdownFlushDeadline;

    public RealtimeProperties(
            @Value("${realtime.bus.subscriber-buffer:1024}") int busSubscriberBuffer,
            @Value("${realtime.notifications.queue-depth:64}") int notificationQueueDepth,
            @Value("${realtime.notifications.max-connections:500}") int maxNotificationConnections,
            @Value("${realtime.notifications.heartbeat-interval-ms:15000}") long heartbeatIntervalMs,
            @Value("${realtime.notifications.idle-timeout-ms:45000}") long idleTimeoutMs,
            @Value("${realtime.notifications.history-size:20}") int historySize,
            @Value("${realtime.notifications.history-max-posts:10000}") long historyMaxPosts,
            @Value("${realtime.comments.queue-depth:128}") int commentQueueDepth,
            @Value("${realtime.comments.replay-size:50}") int replaySize,
            @Value("${realtime.comments.max-length:2000}") int maxCommentLength,
            @Value("${realtime.comments.max-members:5000}") int maxRoomMembers,
            @Value("${realtime.comments.room-grace-ms:60000}") long roomGraceMs,
            @Value("${realtime.shutdown.flush-deadline-ms:2000}") long shutdownFlushDeadlineMs
    ) {
        requirePositive("realtime.bus.subscriber-buffer", busSubscriberBuffer);
        requirePositive("realtime.notifications.queue-depth", notificationQueueDepth);
        requirePositive("realtime.notifications.max-connections", maxNotificationConnections);
        requirePositive("realtime.notifications.heartbeat-interval-ms", heartbeatIntervalMs);
        requirePositive("realtime.notifications.history-size", historySize);
        requirePositive("realtime.comments.queue-depth", commentQueueDepth);
        requirePositive("realtime.comments.max-length", maxCommentLength);
        requirePositive("realtime.comments.max-members", maxRoomMembers);
        if (idleTimeoutMs <= heartbeatIntervalMs) {
            throw new IllegalStateException(String.format(
                    "realtime.notifications.idle-timeout-ms (%d) must exceed the heartbeat interval (%d)",
                    idleTimeoutMs, heartbeatIntervalMs));
        }
        // A joining member receives the whole replay window plus its JOINED notice in one go
        if (commentQueueDepth <= replaySize) {
            throw new IllegalStateException(String.format(
                    "realtime.comments.queue-depth (%d) must be larger than realtime.comments.replay-size (%d)",
                    commentQueueDepth, replaySize));
        }

        this.busSubscriberBuffer = busSubscriberBuffer;
        this.notificationQueueDepth = notificationQueueDepth;
        this.maxNotificationConnections = maxNotificationConnections;
        this.heartbeatInterval = Duration.ofMillis(heartbeatIntervalMs);
        this.idleTimeout = Duration.ofMillis(idleTimeoutMs);
        this.historySize = historySize;
        this.historyMaxPosts = historyMaxPosts;
        this.commentQueueDepth = commentQueueDepth;
        this.replaySize = replaySize;
        this.maxCommentLength = maxCommentLength;
        this.maxRoomMembers = maxRoomMembers;
        this.roomGracePeriod = Duration.ofMillis(roomGraceMs);
        this.shutdownFlushDeadline = Duration.ofMillis(shutdownFlushDeadlineMs);
        log.info("Realtime configuration initialized: notificationQueueDepth={}, commentQueueDepth={}, replaySize={}",
                notificationQueueDepth, commentQueueDepth, replaySize);
    }

    private static void requirePositive(String property, long value) {
        if (value <= 0) {
            throw new IllegalStateException(property + " must be positive, got " + value);
        }
    }
}
