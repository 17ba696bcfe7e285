package com.flagship.order_ledger.projection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically brings every summary row up to its stream head.
 *
 * Covers deliveries lost to a crash, a full executor or a failed listener.
 */
@Component
@ConditionalOnProperty(name = "orders.projection.catch-up.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ProjectionCatchUpScheduler {

    private final OrderSummaryProjection projection;

    @Scheduled(fixedRateString = "${orders.projection.catch-up.interval-ms:5000}")
    public void catchUp() {
        try {
            int behind = projection.catchUp();
            if (behind > 0) {
                log.info("Catch-up processed {} order(s) behind their stream", behind);
            }
        } catch (Exception e) {
            log.error("Error in projection catch-up loop", e);
        }
    }
}
