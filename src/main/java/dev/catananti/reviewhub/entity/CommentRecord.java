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

@Table("comments")
@Getter
@Setter
@ToString(exclude = {"content"})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentRecord {

    @Id
    private Long id;

    @Column("post_id")
    private Long postId;

    @Column("author_id")
    private Long authorId;

    private String content;

    @Column("sequence_number")
    private Long sequenceNumber;

    @Column("created_at")
    private LocalDateTime createdAt;
}
