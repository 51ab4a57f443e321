package dev.catananti.reviewhub.event;

import dev.catananti.reviewhub.config.RealtimeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe between event producers and the distribution hubs.
 * <p>
 * Every subscriber owns a bounded channel. A publish walks the subscribers of its topic while
 * holding the topic monitor, so each subscriber sees the topic's events in publish order.
 * A subscriber whose channel is full is dropped; the publisher never waits.
 */
@Component
@Slf4j
public class EventBus {

    private final int subscriberBuffer;
    private final Map<Topic<?>, TopicChannel<?>> channels = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public EventBus(RealtimeProperties properties) {
        this.subscriberBuffer = properties.getBusSubscriberBuffer();
    }

    /**
     * Publish an event to every current subscriber of the topic.
     *
     * @throws IllegalStateException if the bus has been closed
     */
    public <T> PublishReport publish(Topic<T> topic, T event) {
        Objects.requireNonNull(event, "event");
        TopicChannel<T> channel = channel(topic);
        synchronized (channel) {
            if (closed) {
                throw new IllegalStateException("Event bus is closed");
            }
            PublishReport report = channel.fanOut(event);
            log.debug("Published {} on topic {}: delivered={}, dropped={}",
                    event.getClass().getSimpleName(), topic, report.delivered(), report.dropped());
            return report;
        }
    }

    /**
     * Subscribe to a topic. Registration happens when the returned Flux is subscribed;
     * events published before that are not delivered.
     */
    public <T> Flux<T> subscribe(Topic<T> topic) {
        return Flux.defer(() -> {
            TopicChannel<T> channel = channel(topic);
            Subscription<T> subscription = new Subscription<>(subscriberBuffer);
            synchronized (channel) {
                if (closed) {
                    return Flux.<T>empty();
                }
                channel.subscribers.add(subscription);
            }
            log.debug("New subscriber on topic {}. Total subscribers: {}", topic, channel.subscribers.size());
            return subscription.sink.asFlux()
                    .doFinally(signal -> channel.subscribers.remove(subscription));
        });
    }

    /**
     * Stop accepting publishes, wait for in-flight publishes and complete every subscription.
     */
    public void close() {
        closed = true;
        int completed = 0;
        for (TopicChannel<?> channel : channels.values()) {
            // Taking the monitor waits for any publish still running on this topic
            synchronized (channel) {
                completed += channel.completeAll();
            }
        }
        log.info("Event bus closed, {} subscriptions completed", completed);
    }

    public boolean isClosed() {
        return closed;
    }

    public int subscriberCount(Topic<?> topic) {
        TopicChannel<?> channel = channels.get(topic);
        return channel == null ? 0 : channel.subscribers.size();
    }

    @SuppressWarnings("unchecked")
    private <T> TopicChannel<T> channel(Topic<T> topic) {
        return (TopicChannel<T>) channels.computeIfAbsent(topic, TopicChannel::new);
    }

    private static final class TopicChannel<T> {

        private final Topic<?> topic;
        private final List<Subscription<T>> subscribers = new CopyOnWriteArrayList<>();

        private TopicChannel(Topic<?> topic) {
            this.topic = topic;
        }

        private PublishReport fanOut(T event) {
            if (subscribers.isEmpty()) {
                return PublishReport.EMPTY;
            }
            int delivered = 0;
            int dropped = 0;
            for (Subscription<T> subscription : subscribers) {
                Sinks.EmitResult result = subscription.sink.tryEmitNext(event);
                if (result.isSuccess()) {
                    delivered++;
                } else if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                    dropped++;
                    subscribers.remove(subscription);
                    subscription.sink.tryEmitError(new SubscriberOverflowException(topic.name(), subscription.capacity));
                    log.warn("Dropped slow subscriber on topic {} (channel capacity {})", topic, subscription.capacity);
                } else {
                    // Cancelled or already terminated: the subscriber is gone
                    subscribers.remove(subscription);
                }
            }
            return new PublishReport(delivered, dropped);
        }

        private int completeAll() {
            int count = 0;
            for (Subscription<T> subscription : subscribers) {
                subscription.sink.tryEmitComplete();
                count++;
            }
            subscribers.clear();
            return count;
        }
    }

    private static final class Subscription<T> {

        private final int capacity;
        private final Sinks.Many<T> sink;

        private Subscription(int capacity) {
            this.capacity = capacity;
            this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<T>get(capacity).get());
        }
    }
}
