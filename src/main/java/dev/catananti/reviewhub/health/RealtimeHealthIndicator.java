package dev.catananti.reviewhub.health;

import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.supervisor.Supervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports whether the real-time layer is running and how many streams it holds.
 */
@Component("realtime")
@RequiredArgsConstructor
public class RealtimeHealthIndicator implements ReactiveHealthIndicator {

    private final Supervisor supervisor;
    private final NotificationHub notificationHub;
    private final CommentRoomRegistry commentRooms;

    @Override
    public Mono<Health> health() {
        Health.Builder builder = supervisor.isRunning() ? Health.up() : Health.outOfService();
        return Mono.just(builder
                .withDetail("acceptingConnections", notificationHub.isAccepting())
                .withDetail("notificationConnections", notificationHub.connectionCount())
                .withDetail("commentRooms", commentRooms.roomCount())
                .withDetail("commentMembers", commentRooms.memberCount())
                .build());
    }
}
