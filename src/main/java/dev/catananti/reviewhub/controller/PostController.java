package dev.catananti.reviewhub.controller;

import dev.catananti.reviewhub.comment.CommentMessage;
import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.dto.CommentRequest;
import dev.catananti.reviewhub.dto.DraftRequest;
import dev.catananti.reviewhub.dto.PostResponse;
import dev.catananti.reviewhub.dto.TransitionResponse;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.service.PostService;
import dev.catananti.reviewhub.store.PostStore;
import dev.catananti.reviewhub.workflow.WorkflowEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
@Tag(name = "Posts", description = "Drafts, editing, submission and comments")
@Slf4j
public class PostController {

    private final PostService postService;
    private final WorkflowEngine workflowEngine;
    private final CommentRoomRegistry commentRooms;
    private final PostStore postStore;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a draft owned by the caller")
    public Mono<PostResponse> createDraft(@AuthenticationPrincipal Identity identity,
                                          @Valid @RequestBody DraftRequest request) {
        return postService.createDraft(identity, request);
    }

    @GetMapping
    @Operation(summary = "List approved posts, newest first")
    public Flux<PostResponse> listApproved() {
        return postService.listApproved();
    }

    @GetMapping("/mine")
    @Operation(summary = "List the caller's own posts in every status")
    public Flux<PostResponse> listMine(@AuthenticationPrincipal Identity identity) {
        return postService.listOwn(identity);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a post; unapproved posts are visible to their author and reviewers only")
    public Mono<PostResponse> getPost(@PathVariable Long id, @AuthenticationPrincipal Identity identity) {
        return postService.getPost(id, identity);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Edit the title and content of the caller's own draft or pending post")
    public Mono<PostResponse> updatePost(@PathVariable Long id, @AuthenticationPrincipal Identity identity,
                                         @Valid @RequestBody DraftRequest request) {
        return postService.updatePost(id, identity, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete a post; allowed to its author and to admins")
    public Mono<Void> deletePost(@PathVariable Long id, @AuthenticationPrincipal Identity identity) {
        return postService.deletePost(id, identity);
    }

    @PostMapping("/{id}/submit")
    @Operation(summary = "Submit a draft for review")
    public Mono<TransitionResponse> submit(@PathVariable Long id, @AuthenticationPrincipal Identity identity) {
        return workflowEngine.submit(id, identity.userId()).map(TransitionResponse::from);
    }

    @PostMapping("/{id}/resubmit")
    @Operation(summary = "Send a rejected post back to review")
    public Mono<TransitionResponse> resubmit(@PathVariable Long id, @AuthenticationPrincipal Identity identity) {
        return workflowEngine.resubmit(id, identity.userId()).map(TransitionResponse::from);
    }

    @PostMapping("/{id}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Post a comment to the post's live room")
    public Mono<CommentMessage> comment(@PathVariable Long id, @AuthenticationPrincipal Identity identity,
                                        @Valid @RequestBody CommentRequest request) {
        return postStore.getPost(id)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Post", id)))
                .map(post -> commentRooms.post(id, identity.userId(), request.getText()));
    }
}
