package com.flagship.order_ledger.eventstore;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the event log.
 *
 * Provides methods for:
 * - Reading streams (command handler replay, projection gap refetch)
 * - Reading the current stream version (append check, catch-up)
 * - Finding unrelayed rows (Kafka relay)
 */
@Repository
public interface OrderEventRepository extends JpaRepository<OrderEventEntity, UUID> {

    List<OrderEventEntity> findByAggregateIdOrderBySequenceNumberAsc(UUID aggregateId);

    List<OrderEventEntity> findByAggregateIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(
        UUID aggregateId, long sequenceNumber);

    /**
     * Stream length, 0 for an unknown aggregate.
     */
    @Query("SELECT COALESCE(MAX(e.sequenceNumber), 0L) FROM OrderEventEntity e WHERE e.aggregateId = :aggregateId")
    long findCurrentVersion(@Param("aggregateId") UUID aggregateId);

    @Query("""
        SELECT e.aggregateId AS aggregateId, MAX(e.sequenceNumber) AS version
        FROM OrderEventEntity e
        GROUP BY e.aggregateId
        """)
    List<StreamHead> findStreamHeads();

    /**
     * Locks a batch of unrelayed rows so concurrent relays skip them.
     * Rows that exhausted their relay attempts are left for manual handling.
     */
    @Query(value = """
        SELECT * FROM order_events
        WHERE published_at IS NULL AND relay_attempts < :maxAttempts
        ORDER BY appended_at ASC, aggregate_id ASC, sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OrderEventEntity> findUnrelayedForUpdate(@Param("maxAttempts") int maxAttempts,
                                                  @Param("limit") int limit);

    @Query("SELECT COUNT(e) FROM OrderEventEntity e WHERE e.publishedAt IS NULL")
    long countUnrelayed();

    @Query("SELECT MIN(e.appendedAt) FROM OrderEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnrelayedAppendedAt();

    @Query("""
        SELECT COUNT(e) FROM OrderEventEntity e
        WHERE e.publishedAt IS NULL AND e.relayAttempts >= :maxAttempts
        """)
    long countDeadLettered(@Param("maxAttempts") int maxAttempts);

    /**
     * Closed projection for {@link #findStreamHeads()}.
     */
    interface StreamHead {
        UUID getAggregateId();

        Long getVersion();
    }
}
