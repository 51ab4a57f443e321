package dev.catananti.reviewhub.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.catananti.reviewhub.event.ApprovalEvent;
import dev.catananti.reviewhub.event.Decision;
import dev.catananti.reviewhub.event.SubmittedEvent;
import dev.catananti.reviewhub.event.WorkflowEvent;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Payload pushed to reviewer streams. Only the fields relevant to the type are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationMessage(
        NotificationType type,
        Long postId,
        Long actor,
        String reason,
        Boolean resubmission,
        Long sequenceNumber,
        LocalDateTime timestamp,
        List<Long> pendingPostIds,
        Integer pendingCount
) {

    public static NotificationMessage from(WorkflowEvent event) {
        if (event instanceof SubmittedEvent submitted) {
            return new NotificationMessage(NotificationType.SUBMITTED, submitted.postId(), submitted.authorId(),
                    null, submitted.resubmission(), submitted.sequenceNumber(), submitted.timestamp(), null, null);
        }
        if (event instanceof ApprovalEvent approval) {
            NotificationType type = approval.decision() == Decision.APPROVED
                    ? NotificationType.APPROVED
                    : NotificationType.REJECTED;
            return new NotificationMessage(type, approval.postId(), approval.reviewerId(), approval.reason(),
                    null, approval.sequenceNumber(), approval.timestamp(), null, null);
        }
        throw new IllegalArgumentException("Unsupported workflow event: " + event.getClass().getName());
    }

    public static NotificationMessage snapshot(List<Long> pendingPostIds, LocalDateTime timestamp) {
        return new NotificationMessage(NotificationType.SNAPSHOT, null, null, null, null, null, timestamp,
                List.copyOf(pendingPostIds), pendingPostIds.size());
    }

    public static NotificationMessage heartbeat(LocalDateTime timestamp) {
        return new NotificationMessage(NotificationType.HEARTBEAT, null, null, null, null, null, timestamp, null, null);
    }

    public static NotificationMessage shutdown(LocalDateTime timestamp) {
        return new NotificationMessage(NotificationType.SHUTDOWN, null, null, null, null, null, timestamp, null, null);
    }
}
