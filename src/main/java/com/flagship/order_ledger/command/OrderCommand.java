package com.flagship.order_ledger.command;

import java.util.UUID;

/**
 * Intent to change one order. Never persisted.
 *
 * The command ID is stable across the handler's retries and doubles as the
 * attempt token for external capabilities.
 */
public sealed interface OrderCommand
        permits CreateOrderCommand, AddItemCommand, ConfirmOrderCommand, CancelOrderCommand {

    UUID getCommandId();

    UUID getOrderId();

    CommandType type();
}
