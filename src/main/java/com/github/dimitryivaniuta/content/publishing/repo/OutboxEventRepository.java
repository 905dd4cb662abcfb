package com.github.dimitryivaniuta.content.publishing.repo;

import com.github.dimitryivaniuta.content.publishing.domain.OutboxEvent;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Outbox of post lifecycle events.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Relayable events (PENDING, or RETRY whose backoff has passed), oldest first, row-locked for
     * the caller's transaction. Rows another relay run holds are skipped, not waited for.
     *
     * @param now due cut-off for retried events
     * @param limit batch size
     * @return locked events
     */
    @Query(value = """
            select * from post_outbox
            where status = 'PENDING'
               or (status = 'RETRY' and next_attempt_at <= :now)
            order by created_at asc
            limit :limit
            for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> lockRelayBatch(@Param("now") Instant now, @Param("limit") int limit);

    List<OutboxEvent> findByPostIdOrderByCreatedAtAsc(String postId);
}
