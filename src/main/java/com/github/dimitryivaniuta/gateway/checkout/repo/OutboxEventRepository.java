package com.github.dimitryivaniuta.gateway.checkout.repo;

import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxEvent;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link OutboxEvent}.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Locks the next events that are due for publishing, oldest first.
     *
     * <p>{@code FOR UPDATE SKIP LOCKED} lets several dispatcher instances share the table without ever
     * picking the same row.</p>
     *
     * @param statuses statuses eligible for publishing (NEW, RETRY)
     * @param now events with a later {@code next_attempt_at} are skipped
     * @param limit batch size
     * @return locked events
     */
    @Query(value = """
            select *
              from checkout_outbox
             where status in (:statuses)
               and (next_attempt_at is null or next_attempt_at <= :now)
             order by created_at
             limit :limit
               for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> lockDueEvents(
            @Param("statuses") List<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    List<OutboxEvent> findByTokenOrderByCreatedAt(String token);
}
