package com.flagship.order_ledger.projection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the projection_quarantine table.
 */
@Entity
@Table(name = "projection_quarantine",
       uniqueConstraints = @UniqueConstraint(
           name = "uq_projection_quarantine_position",
           columnNames = {"aggregate_id", "sequence_number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class QuarantinedEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "sequence_number", nullable = false)
    private long sequenceNumber;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "quarantined_at", nullable = false)
    private Instant quarantinedAt;

    public static QuarantinedEventEntity fromDomain(QuarantinedEvent event) {
        return new QuarantinedEventEntity(
            event.getEventId(),
            event.getAggregateId(),
            event.getSequenceNumber(),
            event.getEventType(),
            event.getAttempts(),
            event.getLastError(),
            event.getQuarantinedAt()
        );
    }

    public QuarantinedEvent toDomain() {
        return new QuarantinedEvent(
            this.eventId,
            this.aggregateId,
            this.sequenceNumber,
            this.eventType,
            this.attempts,
            this.lastError,
            this.quarantinedAt
        );
    }
}
