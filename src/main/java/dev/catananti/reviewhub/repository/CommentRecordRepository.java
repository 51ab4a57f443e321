package dev.catananti.reviewhub.repository;

import dev.catananti.reviewhub.entity.CommentRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface CommentRecordRepository extends ReactiveCrudRepository<CommentRecord, Long> {

    @Modifying
    @Query("DELETE FROM comments WHERE post_id = :postId")
    Mono<Integer> deleteByPostId(Long postId);
}
