package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.order.event.OrderEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event the projection gave up on after repeated failures.
 *
 * The projection skips it from then on. Clearing the record and rebuilding
 * the aggregate's row is a manual decision (see {@link OrderSummaryProjection#reconcile(UUID)}).
 */
@Value
public class QuarantinedEvent {
    UUID eventId;
    UUID aggregateId;
    long sequenceNumber;
    String eventType;
    int attempts;
    String lastError;
    Instant quarantinedAt;

    public static QuarantinedEvent of(OrderEvent event, int attempts, String lastError) {
        return new QuarantinedEvent(
            event.getEventId(),
            event.getAggregateId(),
            event.getSequenceNumber(),
            event.getType().name(),
            attempts,
            lastError,
            Instant.now()
        );
    }
}
