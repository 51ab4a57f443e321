package dev.catananti.reviewhub.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.catananti.reviewhub.event.Decision;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Review decision on a pending post")
public class DecisionRequest {

    @NotNull(message = "Decision is required")
    @Schema(description = "APPROVED or REJECTED", example = "REJECTED")
    private Decision decision;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @Schema(description = "Feedback for the author, required when rejecting", example = "Needs sources")
    private String reason;

    @JsonIgnore
    @AssertTrue(message = "A reason is required to reject a post")
    public boolean isReasonGivenForRejection() {
        return decision != Decision.REJECTED || (reason != null && !reason.isBlank());
    }
}
