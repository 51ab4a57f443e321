package dev.catananti.reviewhub.supervisor;

import dev.catananti.reviewhub.comment.CommentArchiver;
import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.config.RealtimeProperties;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.notification.NotificationHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Owns the lifecycle of the real-time layer.
 * <p>
 * On start it attaches the notification hub and the comment archiver to the bus. It drives
 * heartbeats and the idle/empty-room sweeps while running. On stop it refuses new connections,
 * closes the bus and gives every open stream the flush deadline to drain before cutting it off.
 * Uses the default lifecycle phase, so it stops before the web server does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Supervisor implements SmartLifecycle {

    private final EventBus eventBus;
    private final NotificationHub notificationHub;
    private final CommentRoomRegistry commentRooms;
    private final CommentArchiver commentArchiver;
    private final RealtimeMetrics metrics;
    private final RealtimeProperties properties;

    private volatile boolean running;

    @Override
    public void start() {
        if (running) {
            return;
        }
        notificationHub.attach(eventBus);
        commentArchiver.attach(eventBus);
        running = true;
        log.info("Realtime layer started: heartbeat every {}, idle timeout {}",
                properties.getHeartbeatInterval(), properties.getIdleTimeout());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        Duration deadline = properties.getShutdownFlushDeadline();
        log.info("Stopping realtime layer: {} notification streams, {} room members",
                notificationHub.connectionCount(), commentRooms.memberCount());

        notificationHub.stopAccepting();
        commentRooms.stopAccepting();
        eventBus.close();
        try {
            Mono.when(notificationHub.shutdown(deadline), commentRooms.shutdown(deadline))
                    .block(deadline.plusSeconds(1));
        } catch (IllegalStateException e) {
            log.warn("Realtime shutdown did not finish in time: {}", e.getMessage());
        }
        commentArchiver.detach();
        log.info("Realtime layer stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Scheduled(fixedRateString = "${realtime.notifications.heartbeat-interval-ms:15000}",
            initialDelayString = "${realtime.notifications.heartbeat-interval-ms:15000}")
    public void heartbeat() {
        if (!running) {
            return;
        }
        notificationHub.heartbeat();
    }

    @Scheduled(fixedRateString = "${realtime.sweep-interval-ms:5000}", initialDelayString = "${realtime.sweep-interval-ms:5000}")
    public void sweep() {
        if (!running) {
            return;
        }
        int idle = notificationHub.evictIdle();
        int rooms = commentRooms.sweepEmptyRooms();
        if (idle > 0 || rooms > 0) {
            log.debug("Sweep evicted {} idle streams and retired {} empty rooms", idle, rooms);
        }
        metrics.updateGauges(notificationHub.connectionCount(), commentRooms.roomCount(), commentRooms.memberCount());
    }
}
