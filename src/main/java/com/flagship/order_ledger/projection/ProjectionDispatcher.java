package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.eventstore.EventsAppended;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Feeds freshly appended events to the projection on the projection executor.
 *
 * Runs after the appending transaction commits, or immediately when the
 * store appends without one. A failure here is only logged: the catch-up
 * poller finds the row behind its stream and applies the events later.
 */
@Component
@ConditionalOnProperty(name = "orders.projection.dispatch.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ProjectionDispatcher {

    private final OrderSummaryProjection projection;

    @Async("projectionExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEventsAppended(EventsAppended appended) {
        try {
            projection.onEventsAppended(appended.getAggregateId(), appended.getEvents());
        } catch (RuntimeException e) {
            log.warn("Async projection failed for order {}, leaving it to catch-up: {}",
                    appended.getAggregateId(), e.getMessage(), e);
        }
    }
}
