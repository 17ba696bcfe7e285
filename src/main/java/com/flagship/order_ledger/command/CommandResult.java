package com.flagship.order_ledger.command;

import com.flagship.order_ledger.order.event.OrderEvent;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What a successful command produced.
 *
 * The read model may not reflect resultingVersion yet.
 */
@Value
public class CommandResult {
    UUID aggregateId;
    long resultingVersion;
    List<OrderEvent> appendedEvents;

    public static CommandResult noOp(UUID aggregateId, long currentVersion) {
        return new CommandResult(aggregateId, currentVersion, List.of());
    }

    public boolean isNoOp() {
        return appendedEvents.isEmpty();
    }
}
