package com.flagship.order_ledger.projection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuarantinedEventRepository extends JpaRepository<QuarantinedEventEntity, UUID> {

    boolean existsByAggregateIdAndSequenceNumber(UUID aggregateId, long sequenceNumber);

    List<QuarantinedEventEntity> findByAggregateIdOrderBySequenceNumberAsc(UUID aggregateId);

    /**
     * Position of every quarantined event, for leaving them out of lag.
     */
    @Query("SELECT q.aggregateId AS aggregateId, q.sequenceNumber AS sequenceNumber FROM QuarantinedEventEntity q")
    List<Position> findAllPositions();

    @Modifying
    @Query("DELETE FROM QuarantinedEventEntity q WHERE q.aggregateId = :aggregateId")
    int deleteByAggregateId(@Param("aggregateId") UUID aggregateId);

    interface Position {
        UUID getAggregateId();

        Long getSequenceNumber();
    }
}
