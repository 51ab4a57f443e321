package dev.catananti.reviewhub.controller;

import dev.catananti.reviewhub.dto.DecisionRequest;
import dev.catananti.reviewhub.dto.PendingPostsResponse;
import dev.catananti.reviewhub.dto.TransitionResponse;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.store.PostStore;
import dev.catananti.reviewhub.workflow.WorkflowEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/posts")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('ADMIN', 'L1_APPROVER')")
@Tag(name = "Review", description = "Reviewer decisions and the pending queue")
public class AdminPostController {

    private final WorkflowEngine workflowEngine;
    private final PostStore postStore;

    @PostMapping("/{id}/decision")
    @Operation(summary = "Approve or reject a pending post")
    public Mono<TransitionResponse> decide(@PathVariable Long id, @AuthenticationPrincipal Identity reviewer,
                                           @Valid @RequestBody DecisionRequest request) {
        return workflowEngine.decide(id, reviewer, request.getDecision(), request.getReason())
                .map(TransitionResponse::from);
    }

    @GetMapping("/pending")
    @Operation(summary = "Ids of posts awaiting review, oldest first")
    public Mono<PendingPostsResponse> pending() {
        return postStore.findPendingPostIds()
                .collectList()
                .map(PendingPostsResponse::of);
    }
}
