package com.flagship.order_ledger.command;

import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.OrderLine;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Opens a new order.
 *
 * When an idempotency key is given, the order ID is derived from it, so a
 * repeated request lands on the same stream and becomes a no-op.
 */
@Value
public class CreateOrderCommand implements OrderCommand {
    UUID commandId;
    UUID orderId;
    UUID customerId;
    CurrencyCode currency;
    List<OrderLine> items;
    String idempotencyKey;

    public static CreateOrderCommand of(UUID customerId, CurrencyCode currency, List<OrderLine> items) {
        return new CreateOrderCommand(UUID.randomUUID(), UUID.randomUUID(), customerId, currency, items, null);
    }

    public static CreateOrderCommand withIdempotencyKey(String idempotencyKey, UUID customerId,
                                                        CurrencyCode currency, List<OrderLine> items) {
        return new CreateOrderCommand(UUID.randomUUID(), orderIdForKey(idempotencyKey),
                customerId, currency, items, idempotencyKey);
    }

    /**
     * Name-based UUID, so every replica maps the same key to the same order.
     */
    public static UUID orderIdForKey(String idempotencyKey) {
        return UUID.nameUUIDFromBytes(("order:" + idempotencyKey).getBytes(StandardCharsets.UTF_8));
    }

    public boolean isIdempotent() {
        return idempotencyKey != null;
    }

    @Override
    public CommandType type() {
        return CommandType.CREATE_ORDER;
    }
}
