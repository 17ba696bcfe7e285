package com.flagship.order_ledger.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stand-in payment gateway that approves any amount up to a configured limit.
 *
 * Remembers receipts by attempt token so repeated authorizations behave
 * the way a real provider's idempotency keys do.
 * In production this would call the provider's API.
 */
@Component
@Slf4j
public class LoggingPaymentGateway implements PaymentGateway {

    private final Map<String, PaymentReceipt> receiptsByToken = new ConcurrentHashMap<>();
    private final BigDecimal approvalLimit;

    public LoggingPaymentGateway(@Value("${orders.payment.approval-limit:1000000}") BigDecimal approvalLimit) {
        this.approvalLimit = approvalLimit;
    }

    @Override
    public PaymentReceipt authorize(PaymentAuthorization authorization) {
        return receiptsByToken.computeIfAbsent(authorization.getAttemptToken(), token -> {
            if (authorization.getAmount().compareTo(approvalLimit) > 0) {
                log.info("Would decline authorization: orderId={}, amount={} {}, limit={}",
                        authorization.getOrderId(), authorization.getAmount(),
                        authorization.getCurrency(), approvalLimit);
                return PaymentReceipt.declined("Amount exceeds approval limit");
            }
            String transactionId = "auth-" + UUID.randomUUID();
            log.info("Would authorize payment: orderId={}, amount={} {}, transactionId={}",
                    authorization.getOrderId(), authorization.getAmount(),
                    authorization.getCurrency(), transactionId);
            return PaymentReceipt.approved(transactionId);
        });
    }
}
