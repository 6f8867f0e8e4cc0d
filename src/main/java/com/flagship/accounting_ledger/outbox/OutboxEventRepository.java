package com.flagship.accounting_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next batch to publish, in commit order. Rows locked by another publisher
     * instance and rows past the retry limit are skipped.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockPublishableBatch(@Param("limit") int limit,
                                                 @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByCompanyIdAndAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        UUID companyId, String aggregateType, UUID aggregateId);

    /**
     * Unpublished events per aggregate type, as {@code [aggregateType, count]} rows.
     */
    @Query("""
        SELECT e.aggregateType, COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount < :maxRetries
        GROUP BY e.aggregateType
        """)
    List<Object[]> countBacklogByAggregateType(@Param("maxRetries") int maxRetries);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries")
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount < :maxRetries")
    Optional<Instant> findOldestPendingCreatedAt(@Param("maxRetries") int maxRetries);
}
