package com.flagship.order_ledger.integration;

import com.flagship.order_ledger.order.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to hold an order's total on the customer's payment method.
 */
@Value
public class PaymentAuthorization {
    UUID orderId;
    BigDecimal amount;
    CurrencyCode currency;
    String attemptToken;
}
