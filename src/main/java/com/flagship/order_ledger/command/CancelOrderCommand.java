package com.flagship.order_ledger.command;

import lombok.Value;

import java.util.UUID;

@Value
public class CancelOrderCommand implements OrderCommand {
    UUID commandId;
    UUID orderId;
    String reason;

    public static CancelOrderCommand of(UUID orderId, String reason) {
        return new CancelOrderCommand(UUID.randomUUID(), orderId, reason);
    }

    @Override
    public CommandType type() {
        return CommandType.CANCEL_ORDER;
    }
}
