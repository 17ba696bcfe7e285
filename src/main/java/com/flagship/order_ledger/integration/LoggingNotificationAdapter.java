package com.flagship.order_ledger.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stand-in notification channel that logs instead of sending.
 *
 * In production this would hand off to an email/SMS service keyed by the
 * notification token.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    private final Set<String> deliveredTokens = ConcurrentHashMap.newKeySet();

    @Override
    public void orderCreated(OrderNotification notification) {
        if (!deliveredTokens.add(notification.getNotificationToken())) {
            log.debug("Notification {} already sent, skipping", notification.getNotificationToken());
            return;
        }
        log.info("Would send notification: order {} created for customer {}, total {} {}",
                notification.getOrderId(), notification.getCustomerId(),
                notification.getTotalAmount(), notification.getCurrency());
    }

    @Override
    public void orderConfirmed(OrderNotification notification) {
        if (!deliveredTokens.add(notification.getNotificationToken())) {
            log.debug("Notification {} already sent, skipping", notification.getNotificationToken());
            return;
        }
        log.info("Would send notification: order {} confirmed, total {} {}",
                notification.getOrderId(), notification.getTotalAmount(), notification.getCurrency());
    }
}
