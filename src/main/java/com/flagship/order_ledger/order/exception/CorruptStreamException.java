package com.flagship.order_ledger.order.exception;

import java.util.UUID;

/**
 * Replay found a sequence gap, a duplicate, an event of another aggregate,
 * or an event type the write side cannot interpret.
 *
 * Fatal and never retried. The aggregate must be reconciled by hand.
 */
public class CorruptStreamException extends RuntimeException {

    private final UUID aggregateId;

    public CorruptStreamException(UUID aggregateId, String message) {
        super(String.format("Corrupt event stream for order %s: %s", aggregateId, message));
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
