package dev.catananti.reviewhub.notification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.catananti.reviewhub.config.RealtimeProperties;
import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.event.Topic;
import dev.catananti.reviewhub.event.WorkflowEvent;
import dev.catananti.reviewhub.exception.ConnectionRejectedException;
import dev.catananti.reviewhub.exception.UnauthorizedException;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.security.Permission;
import dev.catananti.reviewhub.store.PostStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Pushes workflow events to every connected reviewer stream.
 * <p>
 * Each connection has its own bounded queue. A connection whose queue is full is dropped instead
 * of holding up the dispatch, and connections that consume nothing for longer than the idle
 * timeout are reclaimed by {@link #evictIdle()}. The last few events of every post are kept for
 * late joiners, see {@link #history(Long)}.
 */
@Component
@Slf4j
public class NotificationHub {

    private final PostStore postStore;
    private final AccessPolicy accessPolicy;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final int queueDepth;
    private final int maxConnections;
    private final int historySize;
    private final Duration idleTimeout;

    private final Map<String, HubConnection> connections = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();
    private final Cache<Long, Deque<NotificationMessage>> history;
    private volatile boolean accepting = true;
    private volatile Disposable busSubscription;

    public NotificationHub(PostStore postStore, AccessPolicy accessPolicy, RealtimeMetrics metrics, Clock clock,
                           RealtimeProperties properties) {
        this.postStore = postStore;
        this.accessPolicy = accessPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.queueDepth = properties.getNotificationQueueDepth();
        this.maxConnections = properties.getMaxNotificationConnections();
        this.historySize = properties.getHistorySize();
        this.idleTimeout = properties.getIdleTimeout();
        this.history = Caffeine.newBuilder()
                .maximumSize(properties.getHistoryMaxPosts())
                .build();
    }

    /**
     * Start consuming workflow events from the bus.
     */
    public void attach(EventBus eventBus) {
        busSubscription = eventBus.subscribe(Topic.WORKFLOW)
                .doOnError(e -> log.warn("DeliveryDegraded: workflow subscription lost, re-attaching: {}", e.getMessage()))
                .retry()
                .subscribe(this::dispatch,
                        e -> log.error("Workflow subscription failed: {}", e.getMessage(), e),
                        () -> log.info("Workflow subscription completed"));
        log.info("Notification hub attached to the event bus");
    }

    /**
     * Open a reviewer stream. The first message is a SNAPSHOT of the posts currently pending,
     * followed by live events. The connection is registered before the snapshot is read, so an
     * event may appear both in the snapshot and live; clients deduplicate on sequence number.
     */
    public Flux<NotificationMessage> connect(String connectionId, UserRole role) {
        if (!accessPolicy.allows(role, Permission.SUBSCRIBE_NOTIFICATIONS)) {
            log.warn("Rejected notification stream {} for role {}", connectionId, role);
            return Flux.error(new UnauthorizedException("Notification stream requires a reviewer role"));
        }
        HubConnection connection = new HubConnection(connectionId, role, queueDepth, clock.instant());
        synchronized (registrationLock) {
            if (!accepting) {
                return Flux.error(new ConnectionRejectedException("Notification hub is shutting down"));
            }
            if (connections.size() >= maxConnections) {
                log.warn("Rejected notification stream {}: connection limit {} reached", connectionId, maxConnections);
                return Flux.error(new ConnectionRejectedException("Notification connection limit reached"));
            }
            if (connections.putIfAbsent(connectionId, connection) != null) {
                return Flux.error(new IllegalStateException("Duplicate connection id: " + connectionId));
            }
        }
        log.info("Notification stream {} opened for {}. Active connections: {}", connectionId, role, connections.size());

        Mono<NotificationMessage> snapshot = postStore.findPendingPostIds()
                .collectList()
                .map(ids -> NotificationMessage.snapshot(ids, now()));

        return Flux.concat(snapshot, connection.sink.asFlux())
                .takeUntilOther(connection.kill.asMono())
                .doOnNext(message -> connection.touch(clock.instant()))
                .doFinally(signal -> release(connection, signal));
    }

    /**
     * Close a stream and drop its queue. Safe to call repeatedly and concurrently with a push.
     *
     * @return {@code false} if no such connection was open
     */
    public boolean disconnect(String connectionId) {
        HubConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        connection.terminate();
        connection.released.tryEmitEmpty();
        log.info("Notification stream {} disconnected", connectionId);
        return true;
    }

    void dispatch(WorkflowEvent event) {
        NotificationMessage message = NotificationMessage.from(event);
        remember(message);
        int delivered = 0;
        for (HubConnection connection : connections.values()) {
            if (push(connection, message)) {
                delivered++;
            }
        }
        log.debug("Dispatched {} for post {} to {} streams", message.type(), message.postId(), delivered);
    }

    public void heartbeat() {
        NotificationMessage heartbeat = NotificationMessage.heartbeat(now());
        for (HubConnection connection : connections.values()) {
            push(connection, heartbeat);
        }
    }

    /**
     * Disconnect every stream that has consumed nothing within the idle timeout.
     *
     * @return the number of streams evicted
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (HubConnection connection : connections.values()) {
            if (connection.lastActivity().isBefore(cutoff) && connections.remove(connection.id, connection)) {
                log.warn("Evicting idle notification stream {} (last activity {})", connection.id, connection.lastActivity());
                connection.terminate();
                connection.released.tryEmitEmpty();
                evicted++;
            }
        }
        return evicted;
    }

    public void stopAccepting() {
        synchronized (registrationLock) {
            accepting = false;
        }
    }

    /**
     * Send SHUTDOWN to every stream and complete it. Streams still draining when the deadline
     * passes are cut off.
     */
    public Mono<Void> shutdown(Duration flushDeadline) {
        stopAccepting();
        Disposable subscription = busSubscription;
        if (subscription != null) {
            subscription.dispose();
        }
        List<HubConnection> closing = new ArrayList<>(connections.values());
        NotificationMessage notice = NotificationMessage.shutdown(now());
        for (HubConnection connection : closing) {
            if (push(connection, notice)) {
                connection.complete();
            }
        }
        log.info("Closing {} notification streams", closing.size());
        if (closing.isEmpty()) {
            return Mono.empty();
        }
        return Mono.when(closing.stream().map(connection -> connection.released.asMono()).toList())
                .timeout(flushDeadline)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Notification flush deadline of {} exceeded, forcing close", flushDeadline);
                    closing.forEach(connection -> disconnect(connection.id));
                    return Mono.empty();
                });
    }

    /**
     * Recent notifications of one post, oldest first.
     */
    public List<NotificationMessage> history(Long postId) {
        Deque<NotificationMessage> ring = history.getIfPresent(postId);
        if (ring == null) {
            return List.of();
        }
        synchronized (ring) {
            return List.copyOf(ring);
        }
    }

    /**
     * Drop the history of a post that no longer exists.
     */
    public void forgetHistory(Long postId) {
        history.invalidate(postId);
        log.debug("Forgot notification history of post {}", postId);
    }

    public int connectionCount() {
        return connections.size();
    }

    public List<ConnectionInfo> connections() {
        return connections.values().stream()
                .map(HubConnection::info)
                .sorted(Comparator.comparing(ConnectionInfo::connectedAt))
                .toList();
    }

    public boolean isAccepting() {
        return accepting;
    }

    private boolean push(HubConnection connection, NotificationMessage message) {
        Sinks.EmitResult result = connection.emit(message);
        if (result.isSuccess()) {
            return true;
        }
        if (connections.remove(connection.id, connection)) {
            if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                log.warn("DeliveryDegraded: dropping notification stream {}, outbound queue of {} is full",
                        connection.id, queueDepth);
                metrics.incrementDeliveryDropped(RealtimeMetrics.HUB_NOTIFICATIONS, 1);
            } else {
                log.debug("Dropping notification stream {}: {}", connection.id, result);
            }
            connection.terminate();
            connection.released.tryEmitEmpty();
        }
        return false;
    }

    private void remember(NotificationMessage message) {
        Deque<NotificationMessage> ring = history.get(message.postId(), id -> new ArrayDeque<>(historySize));
        synchronized (ring) {
            ring.addLast(message);
            while (ring.size() > historySize) {
                ring.removeFirst();
            }
        }
    }

    private void release(HubConnection connection, SignalType signal) {
        connection.released.tryEmitEmpty();
        if (connections.remove(connection.id, connection)) {
            log.info("Notification stream {} closed ({}). Active connections: {}", connection.id, signal, connections.size());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
