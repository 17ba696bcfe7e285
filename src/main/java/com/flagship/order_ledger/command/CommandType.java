package com.flagship.order_ledger.command;

/**
 * The closed set of commands an order accepts.
 */
public enum CommandType {
    CREATE_ORDER,
    ADD_ITEM,
    CONFIRM_ORDER,
    CANCEL_ORDER
}
