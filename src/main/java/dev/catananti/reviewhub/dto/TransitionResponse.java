package dev.catananti.reviewhub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.catananti.reviewhub.entity.PostStatus;
import dev.catananti.reviewhub.event.ApprovalEvent;
import dev.catananti.reviewhub.event.SubmittedEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransitionResponse {

    private Long postId;
    private PostStatus status;
    private Long actorId;
    private String reason;
    private boolean resubmission;
    private long sequenceNumber;
    private LocalDateTime timestamp;

    public static TransitionResponse from(SubmittedEvent event) {
        return TransitionResponse.builder()
                .postId(event.postId())
                .status(PostStatus.PENDING)
                .actorId(event.authorId())
                .resubmission(event.resubmission())
                .sequenceNumber(event.sequenceNumber())
                .timestamp(event.timestamp())
                .build();
    }

    public static TransitionResponse from(ApprovalEvent event) {
        return TransitionResponse.builder()
                .postId(event.postId())
                .status(event.decision().targetStatus())
                .actorId(event.reviewerId())
                .reason(event.reason())
                .sequenceNumber(event.sequenceNumber())
                .timestamp(event.timestamp())
                .build();
    }
}
