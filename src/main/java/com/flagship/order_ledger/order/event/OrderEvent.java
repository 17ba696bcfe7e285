package com.flagship.order_ledger.order.event;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable fact in an order's stream.
 *
 * Key design decisions:
 * - Identity is (aggregateId, sequenceNumber); eventId only names the
 *   record for relays and logs, so two deliveries of the same fact are equal
 * - Sequence numbers start at 1 and are assigned by the event store, never by callers
 * - The declared type must agree with the payload's own type tag
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OrderEvent {
    UUID eventId;
    @EqualsAndHashCode.Include
    UUID aggregateId;
    @EqualsAndHashCode.Include
    long sequenceNumber;
    OrderEventType type;
    OrderEventPayload payload;
    Instant occurredAt;

    public OrderEvent(UUID eventId, UUID aggregateId, long sequenceNumber,
                      OrderEventType type, OrderEventPayload payload, Instant occurredAt) {
        if (eventId == null) {
            throw new IllegalArgumentException("Event ID cannot be null");
        }
        if (aggregateId == null) {
            throw new IllegalArgumentException("Aggregate ID cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number must be >= 1, got " + sequenceNumber);
        }
        if (type == null || payload == null) {
            throw new IllegalArgumentException("Event type and payload are required");
        }
        if (payload.type() != type) {
            throw new IllegalArgumentException(
                String.format("Payload %s does not match declared event type %s",
                    payload.getClass().getSimpleName(), type));
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        this.eventId = eventId;
        this.aggregateId = aggregateId;
        this.sequenceNumber = sequenceNumber;
        this.type = type;
        this.payload = payload;
        this.occurredAt = occurredAt;
    }

    /**
     * Creates a new event with a fresh event ID, taking the type from the payload.
     */
    public static OrderEvent of(UUID aggregateId, long sequenceNumber,
                                OrderEventPayload payload, Instant occurredAt) {
        return new OrderEvent(UUID.randomUUID(), aggregateId, sequenceNumber,
                payload == null ? null : payload.type(), payload, occurredAt);
    }
}
