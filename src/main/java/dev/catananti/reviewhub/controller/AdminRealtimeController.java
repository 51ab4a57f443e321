package dev.catananti.reviewhub.controller;

import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.dto.RealtimeStatsResponse;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.notification.NotificationHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/realtime")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Slf4j
public class AdminRealtimeController {

    private final NotificationHub notificationHub;
    private final CommentRoomRegistry commentRooms;

    @GetMapping("/stats")
    public Mono<RealtimeStatsResponse> stats() {
        return Mono.fromSupplier(() -> RealtimeStatsResponse.builder()
                .accepting(notificationHub.isAccepting())
                .notificationConnections(notificationHub.connectionCount())
                .connections(notificationHub.connections())
                .commentRooms(commentRooms.roomCount())
                .commentMembers(commentRooms.memberCount())
                .rooms(commentRooms.roomStats())
                .build());
    }

    /**
     * Force a notification stream or comment room member off.
     */
    @DeleteMapping("/connections/{connectionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> disconnect(@PathVariable String connectionId) {
        return Mono.fromRunnable(() -> {
            boolean found = notificationHub.disconnect(connectionId) | commentRooms.disconnect(connectionId);
            if (!found) {
                throw new ResourceNotFoundException("Connection", connectionId);
            }
            log.info("Forced disconnect of {}", connectionId);
        });
    }
}
