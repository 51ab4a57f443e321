package dev.catananti.reviewhub.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("posts")
@Getter
@Setter
@ToString(exclude = {"content"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    @Id
    private Long id;

    @Column("author_id")
    private Long authorId;

    private String title;
    private String content;

    @Builder.Default
    private String status = "DRAFT"; // DRAFT, PENDING, APPROVED, REJECTED

    // Incremented by every accepted transition; doubles as the per-post event sequence
    @Builder.Default
    private Long revision = 0L;

    @Column("reviewer_id")
    private Long reviewerId;

    @Column("rejection_reason")
    private String rejectionReason;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
