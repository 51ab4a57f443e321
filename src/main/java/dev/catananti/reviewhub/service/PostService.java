package dev.catananti.reviewhub.service;

import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.config.ResilienceConfig;
import dev.catananti.reviewhub.dto.DraftRequest;
import dev.catananti.reviewhub.dto.PostResponse;
import dev.catananti.reviewhub.entity.Post;
import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.exception.InvalidInputException;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.exception.StaleStateException;
import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.repository.ApprovalRecordRepository;
import dev.catananti.reviewhub.repository.CommentRecordRepository;
import dev.catananti.reviewhub.repository.PostRepository;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.security.Permission;
import dev.catananti.reviewhub.store.PostSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Draft creation, editing, deletion and read access to posts. Status changes go through
 * {@link dev.catananti.reviewhub.workflow.WorkflowEngine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    private final PostRepository postRepository;
    private final CommentRecordRepository commentRecordRepository;
    private final ApprovalRecordRepository approvalRecordRepository;
    private final CommentRoomRegistry commentRooms;
    private final NotificationHub notificationHub;
    private final AccessPolicy accessPolicy;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<PostResponse> createDraft(Identity author, DraftRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Post post = Post.builder()
                .authorId(author.userId())
                .title(request.getTitle().trim())
                .content(request.getContent())
                .status(PostStatus.DRAFT.name())
                .revision(0L)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return postRepository.save(post)
                .timeout(resilience.getStoreTimeout())
                .doOnNext(saved -> log.info("Draft {} created by user {}", saved.getId(), author.userId()))
                .map(saved -> toResponse(saved, true));
    }

    /**
     * The author and reviewers see any post with its review metadata. Everyone else sees
     * approved posts only, without it.
     */
    public Mono<PostResponse> getPost(Long postId, Identity viewer) {
        return postRepository.findById(postId)
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry())
                .flatMap(post -> {
                    boolean reviewDetails = accessPolicy.canSeeReviewDetails(viewer, post.getAuthorId());
                    if (!reviewDetails && !PostStatus.APPROVED.matches(post.getStatus())) {
                        return Mono.empty();
                    }
                    return Mono.just(toResponse(post, reviewDetails));
                })
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Post", postId)));
    }

    /**
     * Public listing: approved posts, most recently approved first.
     */
    public Flux<PostResponse> listApproved() {
        return postRepository.findByStatusOrderByUpdatedAtDesc(PostStatus.APPROVED.name())
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry())
                .map(post -> toResponse(post, false));
    }

    /**
     * Every post of the caller whatever its status, newest first.
     */
    public Flux<PostResponse> listOwn(Identity author) {
        return postRepository.findByAuthorIdOrderByCreatedAtDesc(author.userId())
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry())
                .map(post -> toResponse(post, true));
    }

    /**
     * Replace title and content. Only the author may edit, and only while the post is a draft or
     * waiting for review. Editing does not change the status or the revision.
     */
    public Mono<PostResponse> updatePost(Long postId, Identity author, DraftRequest request) {
        return findExisting(postId)
                .flatMap(post -> {
                    accessPolicy.requireAuthor(author.userId(), PostSnapshot.of(post));
                    if (!isEditable(post)) {
                        return Mono.error(new InvalidInputException("Only draft or pending posts can be edited"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    String title = request.getTitle().trim();
                    return postRepository.updateContentIfEditable(postId, author.userId(), title, request.getContent(), now)
                            .timeout(resilience.getStoreTimeout())
                            .flatMap(updated -> {
                                if (updated == 0) {
                                    log.info("Edit of post {} lost to a concurrent decision", postId);
                                    return Mono.error(new StaleStateException(postId));
                                }
                                post.setTitle(title);
                                post.setContent(request.getContent());
                                post.setUpdatedAt(now);
                                log.info("Post {} edited by user {}", postId, author.userId());
                                return Mono.just(toResponse(post, true));
                            });
                });
    }

    /**
     * Delete a post with its comments and review history. Allowed to the author and to admins.
     * Viewers in the post's comment room are sent SHUTDOWN, and its notification history is dropped.
     */
    @Transactional
    public Mono<Void> deletePost(Long postId, Identity caller) {
        return findExisting(postId)
                .flatMap(post -> {
                    accessPolicy.requireAuthorOr(caller, PostSnapshot.of(post), Permission.DELETE_ANY_POST);
                    return commentRecordRepository.deleteByPostId(postId)
                            .then(approvalRecordRepository.deleteByPostId(postId))
                            .then(postRepository.deleteById(postId))
                            .timeout(resilience.getStoreTimeout());
                })
                .then(Mono.defer(() -> {
                    notificationHub.forgetHistory(postId);
                    return commentRooms.closeRoom(postId);
                }))
                .doOnSuccess(done -> log.info("Post {} deleted by user {}", postId, caller.userId()));
    }

    private Mono<Post> findExisting(Long postId) {
        return postRepository.findById(postId)
                .timeout(resilience.getStoreTimeout())
                .retryWhen(resilience.storeReadRetry())
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Post", postId)));
    }

    private static boolean isEditable(Post post) {
        return PostStatus.DRAFT.matches(post.getStatus()) || PostStatus.PENDING.matches(post.getStatus());
    }

    private PostResponse toResponse(Post post, boolean reviewDetails) {
        PostResponse.PostResponseBuilder builder = PostResponse.builder()
                .id(post.getId())
                .authorId(post.getAuthorId())
                .title(post.getTitle())
                .content(post.getContent())
                .status(post.getStatus())
                .createdAt(post.getCreatedAt())
                .updatedAt(post.getUpdatedAt());
        if (reviewDetails) {
            builder.revision(post.getRevision())
                    .reviewerId(post.getReviewerId())
                    .rejectionReason(post.getRejectionReason());
        }
        return builder.build();
    }
}
