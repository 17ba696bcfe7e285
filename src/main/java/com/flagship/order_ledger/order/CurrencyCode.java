package com.flagship.order_ledger.order;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Every line of an order is priced in the order's currency,
 * so the total never mixes currencies.
 */
public enum CurrencyCode {
    JPY, // Japanese Yen
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    INR, // Indian Rupee
}
