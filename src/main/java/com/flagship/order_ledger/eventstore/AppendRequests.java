package com.flagship.order_ledger.eventstore;

import com.flagship.order_ledger.order.event.OrderEvent;
import com.flagship.order_ledger.order.event.OrderEventPayload;
import com.flagship.order_ledger.order.event.OrderEventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Argument checks and sequence assignment shared by the store implementations.
 */
final class AppendRequests {

    private AppendRequests() {
        // Utility class
    }

    static void validate(UUID aggregateId, long expectedVersion,
                         List<OrderEventPayload> payloads, Instant occurredAt) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("Aggregate ID cannot be null");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative: " + expectedVersion);
        }
        if (payloads == null || payloads.isEmpty()) {
            throw new IllegalArgumentException("Nothing to append");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        for (OrderEventPayload payload : payloads) {
            if (payload == null || payload.type() == OrderEventType.UNRECOGNIZED) {
                throw new IllegalArgumentException("Only recognized event types can be appended");
            }
        }
    }

    static List<OrderEvent> sequence(UUID aggregateId, long expectedVersion,
                                     List<OrderEventPayload> payloads, Instant occurredAt) {
        List<OrderEvent> events = new ArrayList<>(payloads.size());
        long sequence = expectedVersion;
        for (OrderEventPayload payload : payloads) {
            events.add(OrderEvent.of(aggregateId, ++sequence, payload, occurredAt));
        }
        return List.copyOf(events);
    }
}
