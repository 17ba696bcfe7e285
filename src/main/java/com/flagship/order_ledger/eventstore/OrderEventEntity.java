package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
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
 * JPA entity for one row of the event log.
 *
 * The unique (aggregate_id, sequence_number) constraint is what makes
 * concurrent appends to the same stream safe: at most one writer can
 * claim a given sequence number.
 *
 * Event columns are written once. The relay_* and published_at columns
 * belong to the Kafka relay and are the only ones ever updated.
 */
@Entity
@Table(name = "order_events",
       uniqueConstraints = @UniqueConstraint(
           name = "uq_order_events_stream",
           columnNames = {"aggregate_id", "sequence_number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OrderEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "aggregate_id", nullable = false, updatable = false)
    private UUID aggregateId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "appended_at", nullable = false, updatable = false)
    private Instant appendedAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "relay_attempts", nullable = false)
    private int relayAttempts = 0;

    @Column(name = "relay_error", columnDefinition = "TEXT")
    private String relayError;

    /**
     * Creates an entity from a domain event and its encoded payload.
     */
    public static OrderEventEntity fromDomain(OrderEvent event, String eventType, String payload) {
        OrderEventEntity entity = new OrderEventEntity();
        entity.setEventId(event.getEventId());
        entity.setAggregateId(event.getAggregateId());
        entity.setSequenceNumber(event.getSequenceNumber());
        entity.setEventType(eventType);
        entity.setPayload(payload);
        entity.setOccurredAt(event.getOccurredAt());
        entity.setAppendedAt(Instant.now());
        return entity;
    }

    /**
     * Converts this row back to a domain event.
     */
    public OrderEvent toDomain(OrderEventCodec codec) {
        return codec.decode(eventId, aggregateId, sequenceNumber, eventType, payload, occurredAt);
    }

    public void markPublished() {
        this.publishedAt = Instant.now();
        this.relayError = null;
    }

    public void markRelayFailed(String errorMessage) {
        this.relayAttempts++;
        this.relayError = errorMessage;
    }
}
