package dev.catananti.reviewhub.notification;

/**
 * Message types on the admin notification stream. Used as the SSE event name.
 */
public enum NotificationType {
    SNAPSHOT,
    SUBMITTED,
    APPROVED,
    REJECTED,
    HEARTBEAT,
    SHUTDOWN
}
