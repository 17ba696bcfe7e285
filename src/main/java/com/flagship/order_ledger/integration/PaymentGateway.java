package com.flagship.order_ledger.integration;

/**
 * Port to the external payment provider.
 *
 * Implementations must be idempotent on {@link PaymentAuthorization#getAttemptToken()}:
 * a second call with the same token returns the first receipt and never
 * places a second hold. The command handler relies on this when it retries
 * a confirm after a concurrency conflict.
 */
public interface PaymentGateway {

    PaymentReceipt authorize(PaymentAuthorization authorization);
}
