package dev.catananti.reviewhub.notification;

import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.event.ApprovalEvent;
import dev.catananti.reviewhub.event.Decision;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.event.SubmittedEvent;
import dev.catananti.reviewhub.event.Topic;
import dev.catananti.reviewhub.exception.ConnectionRejectedException;
import dev.catananti.reviewhub.exception.UnauthorizedException;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.support.InMemoryPostStore;
import dev.catananti.reviewhub.support.MutableClock;
import dev.catananti.reviewhub.support.RealtimeFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.Disposable;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.SignalType;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationHub")
class NotificationHubTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 15, 10, 0);

    private InMemoryPostStore store;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private NotificationHub hub;

    @BeforeEach
    void setUp() {
        store = new InMemoryPostStore()
                .with(1L, 10L, PostStatus.PENDING)
                .with(2L, 10L, PostStatus.DRAFT)
                .with(3L, 11L, PostStatus.PENDING);
        meterRegistry = new SimpleMeterRegistry();
        clock = MutableClock.startingAt("2025-01-15T10:00:00Z");
        hub = hub(RealtimeFixtures.settings().notificationQueueDepth(8));
    }

    private NotificationHub hub(RealtimeFixtures settings) {
        return new NotificationHub(store, new AccessPolicy(), RealtimeFixtures.metrics(meterRegistry), clock,
                settings.build());
    }

    private static SubmittedEvent submitted(long postId, long sequence) {
        return new SubmittedEvent(postId, 10L, false, sequence, NOW);
    }

    private static BaseSubscriber<NotificationMessage> stalled(AtomicBoolean terminated) {
        return new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                // never requests
            }

            @Override
            protected void hookFinally(SignalType type) {
                terminated.set(true);
            }
        };
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        @Test
        @DisplayName("should start every stream with a snapshot of the pending queue")
        void shouldStartWithSnapshot() {
            StepVerifier.create(hub.connect("c1", UserRole.L1_APPROVER))
                    .assertNext(message -> {
                        assertThat(message.type()).isEqualTo(NotificationType.SNAPSHOT);
                        assertThat(message.pendingPostIds()).containsExactly(1L, 3L);
                        assertThat(message.pendingCount()).isEqualTo(2);
                    })
                    .then(() -> hub.dispatch(submitted(2L, 1)))
                    .assertNext(message -> {
                        assertThat(message.type()).isEqualTo(NotificationType.SUBMITTED);
                        assertThat(message.postId()).isEqualTo(2L);
                        assertThat(message.sequenceNumber()).isEqualTo(1L);
                    })
                    .thenCancel()
                    .verify();

            assertThat(hub.connectionCount()).isZero();
        }

        @Test
        @DisplayName("should refuse the USER role")
        void shouldRefuseUserRole() {
            StepVerifier.create(hub.connect("c1", UserRole.USER))
                    .expectError(UnauthorizedException.class)
                    .verify();

            assertThat(hub.connectionCount()).isZero();
        }

        @Test
        @DisplayName("should refuse connections beyond the limit")
        void shouldRefuseBeyondLimit() {
            NotificationHub limited = hub(RealtimeFixtures.settings().maxNotificationConnections(2));
            limited.connect("c1", UserRole.ADMIN);
            limited.connect("c2", UserRole.ADMIN);

            StepVerifier.create(limited.connect("c3", UserRole.ADMIN))
                    .expectError(ConnectionRejectedException.class)
                    .verify();

            assertThat(limited.connectionCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refuse a duplicate connection id")
        void shouldRefuseDuplicateId() {
            hub.connect("c1", UserRole.ADMIN);

            StepVerifier.create(hub.connect("c1", UserRole.ADMIN))
                    .expectError(IllegalStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should refuse new streams once it stops accepting")
        void shouldRefuseAfterStopAccepting() {
            hub.stopAccepting();

            StepVerifier.create(hub.connect("c1", UserRole.ADMIN))
                    .expectError(ConnectionRejectedException.class)
                    .verify();
            assertThat(hub.isAccepting()).isFalse();
        }
    }

    @Nested
    @DisplayName("dispatch")
    class Dispatch {

        @Test
        @DisplayName("should map approval events to APPROVED and REJECTED")
        void shouldMapDecisions() {
            List<NotificationMessage> received = new CopyOnWriteArrayList<>();
            Disposable stream = hub.connect("c1", UserRole.ADMIN).subscribe(received::add);

            hub.dispatch(new ApprovalEvent(1L, 5L, Decision.APPROVED, null, 2, NOW));
            hub.dispatch(new ApprovalEvent(3L, 5L, Decision.REJECTED, "Duplicate", 2, NOW));

            assertThat(received).extracting(NotificationMessage::type)
                    .containsExactly(NotificationType.SNAPSHOT, NotificationType.APPROVED, NotificationType.REJECTED);
            assertThat(received.get(2).reason()).isEqualTo("Duplicate");
            assertThat(received.get(2).actor()).isEqualTo(5L);
            stream.dispose();
        }

        @Test
        @DisplayName("should evict a stream that never reads once its queue is full, leaving the others alone")
        void shouldEvictStalledStream() {
            List<NotificationMessage> fast = new CopyOnWriteArrayList<>();
            Disposable fastStream = hub.connect("fast", UserRole.ADMIN).subscribe(fast::add);
            AtomicBoolean slowTerminated = new AtomicBoolean();
            hub.connect("slow", UserRole.ADMIN).subscribe(stalled(slowTerminated));

            for (int sequence = 1; sequence <= 8; sequence++) {
                hub.dispatch(submitted(100L + sequence, 1));
            }
            assertThat(hub.connectionCount()).isEqualTo(2);

            hub.dispatch(submitted(109L, 1));

            assertThat(hub.connectionCount()).isEqualTo(1);
            assertThat(hub.connections()).extracting(ConnectionInfo::connectionId).containsExactly("fast");
            assertThat(slowTerminated).isTrue();
            assertThat(fast).hasSize(10);
            assertThat(meterRegistry.counter("realtime.delivery.dropped", "hub", RealtimeMetrics.HUB_NOTIFICATIONS)
                    .count()).isEqualTo(1.0);

            hub.dispatch(submitted(110L, 1));
            assertThat(fast).hasSize(11);
            fastStream.dispose();
        }

        @Test
        @DisplayName("should consume workflow events from the bus once attached")
        void shouldConsumeFromBus() {
            EventBus eventBus = new EventBus(RealtimeFixtures.defaults());
            hub.attach(eventBus);
            List<NotificationMessage> received = new CopyOnWriteArrayList<>();
            Disposable stream = hub.connect("c1", UserRole.ADMIN).subscribe(received::add);

            eventBus.publish(Topic.WORKFLOW, submitted(2L, 1));

            assertThat(received).extracting(NotificationMessage::type)
                    .containsExactly(NotificationType.SNAPSHOT, NotificationType.SUBMITTED);
            stream.dispose();
            eventBus.close();
        }

        @Test
        @DisplayName("should keep a bounded history per post, oldest first")
        void shouldKeepBoundedHistory() {
            NotificationHub small = hub(RealtimeFixtures.settings().historySize(2));

            small.dispatch(submitted(7L, 1));
            small.dispatch(new ApprovalEvent(7L, 5L, Decision.REJECTED, "Typos", 2, NOW));
            small.dispatch(new SubmittedEvent(7L, 10L, true, 3, NOW));

            assertThat(small.history(7L)).extracting(NotificationMessage::sequenceNumber).containsExactly(2L, 3L);
            assertThat(small.history(8L)).isEmpty();
        }

        @Test
        @DisplayName("should forget the history of one post only")
        void shouldForgetHistory() {
            hub.dispatch(submitted(7L, 1));
            hub.dispatch(submitted(8L, 1));

            hub.forgetHistory(7L);

            assertThat(hub.history(7L)).isEmpty();
            assertThat(hub.history(8L)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("heartbeat and idle eviction")
    class Liveness {

        @Test
        @DisplayName("should push a heartbeat to every stream")
        void shouldPushHeartbeat() {
            List<NotificationMessage> received = new CopyOnWriteArrayList<>();
            Disposable stream = hub.connect("c1", UserRole.ADMIN).subscribe(received::add);

            hub.heartbeat();

            assertThat(received).extracting(NotificationMessage::type)
                    .containsExactly(NotificationType.SNAPSHOT, NotificationType.HEARTBEAT);
            stream.dispose();
        }

        @Test
        @DisplayName("should evict streams idle past the timeout and keep fresh ones")
        void shouldEvictIdleStreams() {
            AtomicBoolean idleCompleted = new AtomicBoolean();
            hub.connect("idle", UserRole.ADMIN).subscribe(message -> { }, error -> { }, () -> idleCompleted.set(true));
            clock.advance(Duration.ofSeconds(46));
            Disposable fresh = hub.connect("fresh", UserRole.ADMIN).subscribe();

            int evicted = hub.evictIdle();

            assertThat(evicted).isEqualTo(1);
            assertThat(idleCompleted).isTrue();
            assertThat(hub.connections()).extracting(ConnectionInfo::connectionId).containsExactly("fresh");
            fresh.dispose();
        }
    }

    @Nested
    @DisplayName("disconnect and shutdown")
    class Shutdown {

        @Test
        @DisplayName("should force a stream off by id")
        void shouldDisconnectById() {
            AtomicBoolean completed = new AtomicBoolean();
            hub.connect("c1", UserRole.ADMIN).subscribe(message -> { }, error -> { }, () -> completed.set(true));

            assertThat(hub.disconnect("c1")).isTrue();
            assertThat(hub.disconnect("c1")).isFalse();
            assertThat(completed).isTrue();
            assertThat(hub.connectionCount()).isZero();
        }

        @Test
        @DisplayName("should send SHUTDOWN and complete every stream")
        void shouldShutdownStreams() {
            List<NotificationMessage> received = new CopyOnWriteArrayList<>();
            AtomicBoolean completed = new AtomicBoolean();
            hub.connect("c1", UserRole.ADMIN).subscribe(received::add, error -> { }, () -> completed.set(true));

            StepVerifier.create(hub.shutdown(Duration.ofSeconds(1)))
                    .verifyComplete();

            assertThat(received).last().extracting(NotificationMessage::type).isEqualTo(NotificationType.SHUTDOWN);
            assertThat(completed).isTrue();
            assertThat(hub.connectionCount()).isZero();
            assertThat(hub.isAccepting()).isFalse();
        }

        @Test
        @DisplayName("should cut off streams that do not drain by the deadline")
        void shouldForceCloseAfterDeadline() {
            AtomicBoolean terminated = new AtomicBoolean();
            hub.connect("stuck", UserRole.ADMIN).subscribe(stalled(terminated));

            StepVerifier.create(hub.shutdown(Duration.ofMillis(100)))
                    .verifyComplete();

            assertThat(terminated).isTrue();
            assertThat(hub.connectionCount()).isZero();
        }
    }
}
