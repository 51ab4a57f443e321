package dev.catananti.reviewhub.controller;

import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.notification.NotificationMessage;
import dev.catananti.reviewhub.security.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.UUID;

/**
 * SSE endpoint for real-time reviewer notifications.
 * Clients connect to /api/v1/admin/notifications/stream; the first event is a SNAPSHOT of the
 * pending queue, followed by SUBMITTED/APPROVED/REJECTED events and periodic HEARTBEATs.
 * The SSE event name is the message type.
 */
@RestController
@RequestMapping("/api/v1/admin/notifications")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'L1_APPROVER')")
@Slf4j
public class AdminNotificationController {

    private final NotificationHub notificationHub;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<NotificationMessage>> stream(@AuthenticationPrincipal Identity identity) {
        String connectionId = UUID.randomUUID().toString();
        log.debug("User {} subscribing to notification stream as {}", identity.userId(), connectionId);
        return notificationHub.connect(connectionId, identity.role())
                .map(message -> ServerSentEvent.<NotificationMessage>builder()
                        .id(message.sequenceNumber() != null ? message.postId() + ":" + message.sequenceNumber() : null)
                        .event(message.type().name())
                        .data(message)
                        .build());
    }

    @GetMapping("/posts/{postId}/history")
    public List<NotificationMessage> history(@PathVariable Long postId) {
        return notificationHub.history(postId);
    }
}
