package com.flagship.order_ledger.integration;

/**
 * Port for customer-facing notifications.
 *
 * Implementations must ignore a notification whose token they have already
 * delivered. Tokens are derived from the stream position of the fact being
 * announced, so the same fact always yields the same token.
 */
public interface NotificationPort {

    void orderCreated(OrderNotification notification);

    void orderConfirmed(OrderNotification notification);
}
