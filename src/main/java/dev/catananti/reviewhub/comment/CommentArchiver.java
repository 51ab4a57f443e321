package dev.catananti.reviewhub.comment;

import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.event.Topic;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Writes broadcast comments to the store, one at a time in bus order.
 * A failed write is logged and skipped; it never affects the live room.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommentArchiver {

    private final PostStore postStore;
    private final RealtimeMetrics metrics;

    private volatile Disposable subscription;

    public void attach(EventBus eventBus) {
        subscription = eventBus.subscribe(Topic.COMMENTS)
                .concatMap(this::archive)
                .doOnError(e -> log.warn("DeliveryDegraded: comment archive subscription lost, re-attaching: {}", e.getMessage()))
                .retry()
                .subscribe(null,
                        e -> log.error("Comment archiver failed: {}", e.getMessage(), e),
                        () -> log.info("Comment archiver stopped"));
        log.info("Comment archiver attached to the event bus");
    }

    public void detach() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }

    Mono<Void> archive(CommentMessage message) {
        return postStore.appendComment(message)
                .doOnSuccess(ignored -> log.debug("Archived comment {}#{}", message.postId(), message.sequenceNumber()))
                .onErrorResume(e -> {
                    log.error("Failed to archive comment {}#{}: {}", message.postId(), message.sequenceNumber(), e.getMessage());
                    metrics.incrementArchiveFailed();
                    return Mono.empty();
                });
    }
}
