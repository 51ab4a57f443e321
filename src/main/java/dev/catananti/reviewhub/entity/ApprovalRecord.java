package dev.catananti.reviewhub.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only audit row for a review decision.
 */
@Table("approval_events")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRecord {

    @Id
    private Long id;

    @Column("post_id")
    private Long postId;

    @Column("reviewer_id")
    private Long reviewerId;

    private String decision;

    private String reason;

    @Column("sequence_number")
    private Long sequenceNumber;

    @Column("created_at")
    private LocalDateTime createdAt;
}
