package dev.catananti.reviewhub.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeMetrics {

    public static final String HUB_BUS = "bus";
    public static final String HUB_NOTIFICATIONS = "notifications";
    public static final String HUB_COMMENTS = "comments";

    private final MeterRegistry meterRegistry;

    private final AtomicLong notificationConnections = new AtomicLong(0);
    private final AtomicLong activeRooms = new AtomicLong(0);
    private final AtomicLong roomMembers = new AtomicLong(0);

    private Counter busDroppedCounter;
    private Counter notificationsDroppedCounter;
    private Counter commentsDroppedCounter;
    private Counter staleStateCounter;
    private Counter commentsPostedCounter;
    private Counter commentsArchiveFailedCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("realtime.notifications.connections", notificationConnections, AtomicLong::get)
                .description("Open admin notification streams")
                .register(meterRegistry);

        Gauge.builder("realtime.comments.rooms", activeRooms, AtomicLong::get)
                .description("Live comment rooms")
                .register(meterRegistry);

        Gauge.builder("realtime.comments.members", roomMembers, AtomicLong::get)
                .description("Members across all comment rooms")
                .register(meterRegistry);

        busDroppedCounter = meterRegistry.counter("realtime.delivery.dropped", "hub", HUB_BUS);
        notificationsDroppedCounter = meterRegistry.counter("realtime.delivery.dropped", "hub", HUB_NOTIFICATIONS);
        commentsDroppedCounter = meterRegistry.counter("realtime.delivery.dropped", "hub", HUB_COMMENTS);
        staleStateCounter = meterRegistry.counter("workflow.transitions.stale");
        commentsPostedCounter = meterRegistry.counter("realtime.comments.posted");
        commentsArchiveFailedCounter = meterRegistry.counter("realtime.comments.archive.failed");
    }

    public void updateGauges(long connections, long rooms, long members) {
        notificationConnections.set(connections);
        activeRooms.set(rooms);
        roomMembers.set(members);
    }

    public void incrementDeliveryDropped(String hub, int count) {
        if (count <= 0) {
            return;
        }
        switch (hub) {
            case HUB_BUS -> busDroppedCounter.increment(count);
            case HUB_NOTIFICATIONS -> notificationsDroppedCounter.increment(count);
            case HUB_COMMENTS -> commentsDroppedCounter.increment(count);
            default -> meterRegistry.counter("realtime.delivery.dropped", "hub", hub).increment(count);
        }
    }

    public void incrementTransition(String target) {
        meterRegistry.counter("workflow.transitions", "target", target).increment();
    }

    public void incrementStaleState() {
        staleStateCounter.increment();
    }

    public void incrementCommentPosted() {
        commentsPostedCounter.increment();
    }

    public void incrementArchiveFailed() {
        commentsArchiveFailedCounter.increment();
    }
}
