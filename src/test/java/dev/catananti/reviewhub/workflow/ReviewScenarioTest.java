package dev.catananti.reviewhub.workflow;

import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.event.Decision;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.notification.NotificationMessage;
import dev.catananti.reviewhub.notification.NotificationType;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.support.InMemoryPostStore;
import dev.catananti.reviewhub.support.MutableClock;
import dev.catananti.reviewhub.support.RealtimeFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Author submits, two admins watch the queue, one approves, a late admin sees the queue without the post.
 */
@DisplayName("Review scenario")
class ReviewScenarioTest {

    private static final Long POST = 1L;
    private static final Long AUTHOR = 10L;

    private InMemoryPostStore store;
    private EventBus eventBus;
    private NotificationHub hub;
    private WorkflowEngine engine;
    private final List<Disposable> streams = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryPostStore().with(POST, AUTHOR, PostStatus.DRAFT);
        MutableClock clock = MutableClock.startingAt("2025-01-15T10:00:00Z");
        RealtimeMetrics metrics = RealtimeFixtures.metrics(new SimpleMeterRegistry());
        AccessPolicy accessPolicy = new AccessPolicy();
        eventBus = new EventBus(RealtimeFixtures.defaults());
        hub = new NotificationHub(store, accessPolicy, metrics, clock, RealtimeFixtures.defaults());
        hub.attach(eventBus);
        engine = new WorkflowEngine(store, eventBus, accessPolicy, metrics, clock);
    }

    @AfterEach
    void tearDown() {
        streams.forEach(Disposable::dispose);
        eventBus.close();
    }

    private List<NotificationMessage> watch(String connectionId) {
        List<NotificationMessage> received = new CopyOnWriteArrayList<>();
        streams.add(hub.connect(connectionId, UserRole.ADMIN).subscribe(received::add));
        return received;
    }

    @Test
    @DisplayName("both admins see the submission and the approval with the same sequence numbers")
    void submitApproveAndSnapshot() {
        List<NotificationMessage> first = watch("admin-a");
        List<NotificationMessage> second = watch("admin-b");

        engine.submit(POST, AUTHOR).block();

        assertThat(first).extracting(NotificationMessage::type)
                .containsExactly(NotificationType.SNAPSHOT, NotificationType.SUBMITTED);
        assertThat(second.get(1)).isEqualTo(first.get(1));
        assertThat(first.get(1).postId()).isEqualTo(POST);
        assertThat(first.get(1).sequenceNumber()).isEqualTo(1L);

        engine.decide(POST, new Identity(1L, UserRole.ADMIN), Decision.APPROVED, null).block();

        assertThat(first).hasSize(3);
        assertThat(second).hasSize(3);
        assertThat(first.get(2).type()).isEqualTo(NotificationType.APPROVED);
        assertThat(first.get(2).sequenceNumber()).isEqualTo(2L);
        assertThat(second.get(2)).isEqualTo(first.get(2));

        List<NotificationMessage> late = watch("admin-c");
        assertThat(late).singleElement().satisfies(snapshot -> {
            assertThat(snapshot.type()).isEqualTo(NotificationType.SNAPSHOT);
            assertThat(snapshot.pendingPostIds()).doesNotContain(POST);
            assertThat(snapshot.pendingCount()).isZero();
        });
        assertThat(hub.history(POST)).extracting(NotificationMessage::type)
                .containsExactly(NotificationType.SUBMITTED, NotificationType.APPROVED);
    }
}
