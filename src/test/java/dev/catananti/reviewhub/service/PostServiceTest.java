package dev.catananti.reviewhub.service;

import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.config.ResilienceConfig;
import dev.catananti.reviewhub.dto.DraftRequest;
import dev.catananti.reviewhub.entity.Post;
import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.exception.InvalidInputException;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.exception.StaleStateException;
import dev.catananti.reviewhub.exception.UnauthorizedException;
import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.repository.ApprovalRecordRepository;
import dev.catananti.reviewhub.repository.CommentRecordRepository;
import dev.catananti.reviewhub.repository.PostRepository;
import dev.catananti.reviewhub.security.AccessPolicy;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PostService")
class PostServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 15, 10, 0);

    @Mock
    private PostRepository postRepository;

    @Mock
    private CommentRecordRepository commentRecordRepository;

    @Mock
    private ApprovalRecordRepository approvalRecordRepository;

    @Mock
    private CommentRoomRegistry commentRooms;

    @Mock
    private NotificationHub notificationHub;

    private PostService postService;

    private final Identity author = new Identity(5L, UserRole.USER);
    private final Identity stranger = new Identity(6L, UserRole.USER);
    private final Identity reviewer = new Identity(2L, UserRole.L1_APPROVER);
    private final Identity admin = new Identity(1L, UserRole.ADMIN);

    @BeforeEach
    void setUp() {
        postService = new PostService(postRepository, commentRecordRepository, approvalRecordRepository,
                commentRooms, notificationHub, new AccessPolicy(), new ResilienceConfig(5, 2, 1, 5),
                MutableClock.startingAt("2025-01-15T10:00:00Z"));
    }

    private static Post post(String status) {
        return Post.builder()
                .id(1L)
                .authorId(5L)
                .title("Reactive streams")
                .content("Backpressure explained")
                .status(status)
                .revision(2L)
                .reviewerId(2L)
                .rejectionReason("REJECTED".equals(status) ? "Needs sources" : null)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("createDraft")
    class CreateDraft {

        @Test
        @DisplayName("should store a DRAFT at revision 0 owned by the caller")
        void shouldCreateDraft() {
            when(postRepository.save(any(Post.class))).thenAnswer(invocation -> {
                Post saved = invocation.getArgument(0);
                saved.setId(11L);
                return Mono.just(saved);
            });

            DraftRequest request = DraftRequest.builder().title("  Reactive streams ").content("Backpressure explained").build();

            StepVerifier.create(postService.createDraft(author, request))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo(11L);
                        assertThat(response.getStatus()).isEqualTo("DRAFT");
                        assertThat(response.getRevision()).isZero();
                        assertThat(response.getTitle()).isEqualTo("Reactive streams");
                    })
                    .verifyComplete();

            ArgumentCaptor<Post> captor = ArgumentCaptor.forClass(Post.class);
            verify(postRepository).save(captor.capture());
            assertThat(captor.getValue().getAuthorId()).isEqualTo(5L);
            assertThat(captor.getValue().getCreatedAt()).isEqualTo(NOW);
        }
    }

    @Nested
    @DisplayName("getPost")
    class GetPost {

        @Test
        @DisplayName("should show a rejected post with its reason to the author")
        void authorSeesRejectionReason() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("REJECTED")));

            StepVerifier.create(postService.getPost(1L, author))
                    .assertNext(response -> {
                        assertThat(response.getRejectionReason()).isEqualTo("Needs sources");
                        assertThat(response.getReviewerId()).isEqualTo(2L);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should show a pending post to reviewers")
        void reviewerSeesPendingPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));

            StepVerifier.create(postService.getPost(1L, reviewer))
                    .assertNext(response -> assertThat(response.getStatus()).isEqualTo("PENDING"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should hide unapproved posts from other users")
        void strangerCannotSeeDraft() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("REJECTED")));

            StepVerifier.create(postService.getPost(1L, stranger))
                    .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                            && error.getMessage().equals("Post not found: 1"))
                    .verify();
        }

        @Test
        @DisplayName("should show approved posts to anonymous readers without review metadata")
        void anonymousSeesApprovedPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("APPROVED")));

            StepVerifier.create(postService.getPost(1L, null))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo("APPROVED");
                        assertThat(response.getReviewerId()).isNull();
                        assertThat(response.getRevision()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should answer not found for a missing post")
        void missingPost() {
            when(postRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(postService.getPost(404L, reviewer))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("listing")
    class Listing {

        @Test
        @DisplayName("should list approved posts without review metadata")
        void shouldListApproved() {
            when(postRepository.findByStatusOrderByUpdatedAtDesc("APPROVED")).thenReturn(Flux.just(post("APPROVED")));

            StepVerifier.create(postService.listApproved())
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo("APPROVED");
                        assertThat(response.getReviewerId()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should list the caller's own posts with review metadata")
        void shouldListOwn() {
            when(postRepository.findByAuthorIdOrderByCreatedAtDesc(5L))
                    .thenReturn(Flux.just(post("REJECTED"), post("DRAFT")));

            StepVerifier.create(postService.listOwn(author))
                    .assertNext(response -> assertThat(response.getRejectionReason()).isEqualTo("Needs sources"))
                    .assertNext(response -> assertThat(response.getStatus()).isEqualTo("DRAFT"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("updatePost")
    class UpdatePost {

        private final DraftRequest edit = DraftRequest.builder().title(" Reactive streams, revised ").content("Now with sources").build();

        @Test
        @DisplayName("should let the author edit a pending post without touching status or revision")
        void authorEditsPendingPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));
            when(postRepository.updateContentIfEditable(1L, 5L, "Reactive streams, revised", "Now with sources", NOW))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(postService.updatePost(1L, author, edit))
                    .assertNext(response -> {
                        assertThat(response.getTitle()).isEqualTo("Reactive streams, revised");
                        assertThat(response.getContent()).isEqualTo("Now with sources");
                        assertThat(response.getStatus()).isEqualTo("PENDING");
                        assertThat(response.getRevision()).isEqualTo(2L);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse to edit a decided post")
        void shouldRefuseDecidedPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("APPROVED")));

            StepVerifier.create(postService.updatePost(1L, author, edit))
                    .expectErrorMatches(error -> error instanceof InvalidInputException
                            && error.getMessage().equals("Only draft or pending posts can be edited"))
                    .verify();
            verify(postRepository, never()).updateContentIfEditable(anyLong(), anyLong(), anyString(), anyString(), any());
        }

        @Test
        @DisplayName("should refuse edits by anyone but the author, reviewers included")
        void shouldRefuseNonAuthor() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));

            StepVerifier.create(postService.updatePost(1L, admin, edit))
                    .expectError(UnauthorizedException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report a conflict when a decision lands between read and write")
        void shouldReportLostRace() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));
            when(postRepository.updateContentIfEditable(eq(1L), eq(5L), anyString(), anyString(), any()))
                    .thenReturn(Mono.just(0));

            StepVerifier.create(postService.updatePost(1L, author, edit))
                    .expectError(StaleStateException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("deletePost")
    class DeletePost {

        private void allowDelete() {
            when(commentRecordRepository.deleteByPostId(1L)).thenReturn(Mono.just(3));
            when(approvalRecordRepository.deleteByPostId(1L)).thenReturn(Mono.just(2));
            when(postRepository.deleteById(1L)).thenReturn(Mono.empty());
            when(commentRooms.closeRoom(1L)).thenReturn(Mono.empty());
        }

        @Test
        @DisplayName("should delete comments and review history before the post, then close its room")
        void authorDeletesPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));
            allowDelete();

            StepVerifier.create(postService.deletePost(1L, author)).verifyComplete();

            InOrder order = inOrder(commentRecordRepository, approvalRecordRepository, postRepository, notificationHub, commentRooms);
            order.verify(commentRecordRepository).deleteByPostId(1L);
            order.verify(approvalRecordRepository).deleteByPostId(1L);
            order.verify(postRepository).deleteById(1L);
            order.verify(notificationHub).forgetHistory(1L);
            order.verify(commentRooms).closeRoom(1L);
        }

        @Test
        @DisplayName("should let an admin delete someone else's post")
        void adminDeletesPost() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("APPROVED")));
            allowDelete();

            StepVerifier.create(postService.deletePost(1L, admin)).verifyComplete();

            verify(postRepository).deleteById(1L);
        }

        @Test
        @DisplayName("should refuse a reviewer who is not the author and delete nothing")
        void reviewerMayNotDelete() {
            when(postRepository.findById(1L)).thenReturn(Mono.just(post("PENDING")));

            StepVerifier.create(postService.deletePost(1L, reviewer))
                    .expectError(UnauthorizedException.class)
                    .verify();

            verify(postRepository, never()).deleteById(anyLong());
            verifyNoInteractions(commentRecordRepository, approvalRecordRepository, commentRooms, notificationHub);
        }

        @Test
        @DisplayName("should answer not found for a missing post")
        void missingPost() {
            when(postRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(postService.deletePost(404L, admin))
                    .expectError(ResourceNotFoundException.class)
                    .verify();

            verifyNoInteractions(commentRooms, notificationHub);
        }
    }
}
