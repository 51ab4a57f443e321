package dev.catananti.reviewhub.comment;

import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * One viewer connected to a room. Emits into {@link #sink} happen under the room's monitor.
 */
final class RoomMember {

    final String connectionId;
    final Long viewerId;
    final Sinks.Many<RoomMessage> sink;
    final Sinks.One<Boolean> kill = Sinks.one();
    final Sinks.Empty<Void> released = Sinks.empty();

    RoomMember(String connectionId, Long viewerId, int queueDepth) {
        this.connectionId = connectionId;
        this.viewerId = viewerId;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<RoomMessage>get(queueDepth).get());
    }
}
