package dev.catananti.reviewhub.store;

import dev.catananti.reviewhub.comment.CommentMessage;
import dev.catananti.reviewhub.config.ResilienceConfig;
import dev.catananti.reviewhub.entity.ApprovalRecord;
import dev.catananti.reviewhub.entity.CommentRecord;
import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.event.ApprovalEvent;
import dev.catananti.reviewhub.repository.ApprovalRecordRepository;
import dev.catananti.reviewhub.repository.CommentRecordRepository;
import dev.catananti.reviewhub.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
@Slf4j
public class R2dbcPostStore implements PostStore {

    private final PostRepository postRepository;
    private final ApprovalRecordRepository approvalRecordRepository;
    private final CommentRecordRepository commentRecordRepository;
    private final ResilienceConfig resilience;
    private final Clock clock;

    @Override
    public Mono<PostSnapshot> getPost(Long postId) {
        return postRepository.findById(postId)
                .map(PostSnapshot::of)
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry());
    }

    @Override
    public Mono<Boolean> compareAndSetStatus(PostSnapshot expected, PostStatus next, Long reviewerId, String reason) {
        return postRepository.compareAndSetStatus(expected.id(), expected.status().name(), expected.revision(),
                        next.name(), reviewerId, reason, LocalDateTime.now(clock))
                .timeout(resilience.getStoreTimeout())
                .map(updated -> updated == 1)
                .doOnNext(swapped -> {
                    if (!swapped) {
                        log.debug("Compare-and-set lost on post {} (expected {} at revision {})",
                                expected.id(), expected.status(), expected.revision());
                    }
                });
    }

    @Override
    public Mono<Void> appendApprovalEvent(ApprovalEvent event) {
        ApprovalRecord record = ApprovalRecord.builder()
                .postId(event.postId())
                .reviewerId(event.reviewerId())
                .decision(event.decision().name())
                .reason(event.reason())
                .sequenceNumber(event.sequenceNumber())
                .createdAt(event.timestamp())
                .build();
        return approvalRecordRepository.save(record)
                .timeout(resilience.getStoreTimeout())
                .then();
    }

    @Override
    public Mono<Void> appendComment(CommentMessage message) {
        CommentRecord record = CommentRecord.builder()
                .postId(message.postId())
                .authorId(message.authorId())
                .content(message.text())
                .sequenceNumber(message.sequenceNumber())
                .createdAt(message.timestamp())
                .build();
        return commentRecordRepository.save(record)
                .timeout(resilience.getStoreTimeout())
                .then();
    }

    @Override
    public Flux<Long> findPendingPostIds() {
        return postRepository.findPendingIds()
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry());
    }
}
