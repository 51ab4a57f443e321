package dev.catananti.reviewhub.repository;

import dev.catananti.reviewhub.entity.ApprovalRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ApprovalRecordRepository extends ReactiveCrudRepository<ApprovalRecord, Long> {

    @Modifying
    @Query("DELETE FROM approval_events WHERE post_id = :postId")
    Mono<Integer> deleteByPostId(Long postId);
}
