package dev.catananti.reviewhub.notification;

import dev.catananti.reviewhub.entity.UserRole;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Instant;

/**
 * One reviewer stream. Emits are serialized on this object's monitor since the workflow
 * dispatch and the heartbeat run on different threads.
 */
final class HubConnection {

    final String id;
    final UserRole role;
    final Instant connectedAt;
    final Sinks.Many<NotificationMessage> sink;
    final Sinks.One<Boolean> kill = Sinks.one();
    final Sinks.Empty<Void> released = Sinks.empty();
    private volatile Instant lastActivity;

    HubConnection(String id, UserRole role, int queueDepth, Instant connectedAt) {
        this.id = id;
        this.role = role;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<NotificationMessage>get(queueDepth).get());
    }

    synchronized Sinks.EmitResult emit(NotificationMessage message) {
        return sink.tryEmitNext(message);
    }

    synchronized void complete() {
        sink.tryEmitComplete();
    }

    /**
     * Cut the stream off immediately, discarding anything still queued.
     */
    void terminate() {
        kill.tryEmitValue(Boolean.TRUE);
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    ConnectionInfo info() {
        return new ConnectionInfo(id, role, connectedAt, lastActivity);
    }
}
