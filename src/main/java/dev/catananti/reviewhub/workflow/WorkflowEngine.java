package dev.catananti.reviewhub.workflow;

import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.event.ApprovalEvent;
import dev.catananti.reviewhub.event.Decision;
import dev.catananti.reviewhub.event.EventBus;
import dev.catananti.reviewhub.event.PublishReport;
import dev.catananti.reviewhub.event.SubmittedEvent;
import dev.catananti.reviewhub.event.Topic;
import dev.catananti.reviewhub.event.WorkflowEvent;
import dev.catananti.reviewhub.exception.InvalidTransitionException;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.exception.StaleStateException;
import dev.catananti.reviewhub.metrics.RealtimeMetrics;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.security.Permission;
import dev.catananti.reviewhub.store.PostSnapshot;
import dev.catananti.reviewhub.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * State machine of a post under review.
 * <pre>
 * DRAFT --submit--> PENDING --decide--> APPROVED
 *                      ^          \---> REJECTED --resubmit--+
 *                      +-------------------------------------+
 * </pre>
 * Every transition is a compare-and-set on (status, revision), so of two racing callers
 * exactly one wins and the other gets {@link StaleStateException}. The winner's event is
 * published on the bus before the returned Mono completes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEngine {

    private final PostStore postStore;
    private final EventBus eventBus;
    private final AccessPolicy accessPolicy;
    private final RealtimeMetrics metrics;
    private final Clock clock;

    public Mono<SubmittedEvent> submit(Long postId, Long authorId) {
        return load(postId)
                .flatMap(post -> {
                    accessPolicy.requireAuthor(authorId, post);
                    requireStatus(post, PostStatus.DRAFT, PostStatus.PENDING);
                    return swap(post, PostStatus.PENDING, null, null);
                })
                .map(sequence -> new SubmittedEvent(postId, authorId, false, sequence, now()))
                .doOnNext(this::publish);
    }

    public Mono<ApprovalEvent> decide(Long postId, Identity reviewer, Decision decision, String reason) {
        return Mono.fromRunnable(() -> accessPolicy.require(reviewer, Permission.DECIDE_POST))
                .then(Mono.defer(() -> load(postId)))
                .flatMap(post -> {
                    requireStatus(post, PostStatus.PENDING, decision.targetStatus());
                    return swap(post, decision.targetStatus(), reviewer.userId(), reason);
                })
                .map(sequence -> new ApprovalEvent(postId, reviewer.userId(), decision, reason, sequence, now()))
                .flatMap(event -> postStore.appendApprovalEvent(event)
                        .doOnError(e -> log.error("Failed to record approval event {}#{}: {}",
                                postId, event.sequenceNumber(), e.getMessage()))
                        .onErrorResume(e -> Mono.empty())
                        .thenReturn(event))
                .doOnNext(this::publish);
    }

    public Mono<SubmittedEvent> resubmit(Long postId, Long authorId) {
        return load(postId)
                .flatMap(post -> {
                    accessPolicy.requireAuthor(authorId, post);
                    requireStatus(post, PostStatus.REJECTED, PostStatus.PENDING);
                    return swap(post, PostStatus.PENDING, null, null);
                })
                .map(sequence -> new SubmittedEvent(postId, authorId, true, sequence, now()))
                .doOnNext(this::publish);
    }

    private Mono<PostSnapshot> load(Long postId) {
        return postStore.getPost(postId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Post", postId)));
    }

    private void requireStatus(PostSnapshot post, PostStatus required, PostStatus target) {
        if (post.status() != required) {
            log.warn("Rejected transition of post {} from {} to {}", post.id(), post.status(), target);
            throw new InvalidTransitionException(post.id(), post.status(), target);
        }
    }

    /**
     * @return the sequence number of the transition, which is the post's new revision
     */
    private Mono<Long> swap(PostSnapshot post, PostStatus next, Long reviewerId, String reason) {
        return postStore.compareAndSetStatus(post, next, reviewerId, reason)
                .flatMap(swapped -> {
                    if (!swapped) {
                        metrics.incrementStaleState();
                        log.warn("Stale transition of post {} to {}: revision {} is no longer current",
                                post.id(), next, post.revision());
                        return Mono.error(new StaleStateException(post.id()));
                    }
                    metrics.incrementTransition(next.name());
                    log.info("Post {} moved {} -> {} (revision {})", post.id(), post.status(), next, post.revision() + 1);
                    return Mono.just(post.revision() + 1);
                });
    }

    private void publish(WorkflowEvent event) {
        try {
            PublishReport report = eventBus.publish(Topic.WORKFLOW, event);
            if (report.degraded()) {
                log.warn("DeliveryDegraded: {} for post {} dropped {} bus subscribers",
                        event.getClass().getSimpleName(), event.postId(), report.dropped());
                metrics.incrementDeliveryDropped(RealtimeMetrics.HUB_BUS, report.dropped());
            }
        } catch (IllegalStateException e) {
            // The transition is already persisted; only delivery is lost
            log.warn("DeliveryDegraded: {} for post {} not published: {}",
                    event.getClass().getSimpleName(), event.postId(), e.getMessage());
            metrics.incrementDeliveryDropped(RealtimeMetrics.HUB_BUS, 1);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
