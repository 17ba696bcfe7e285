package com.flagship.order_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need database queries, so a Prometheus scrape never does.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final ProjectionMetrics projectionMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshProjectionMetrics() {
        projectionMetrics.refreshMetrics();
    }
}
