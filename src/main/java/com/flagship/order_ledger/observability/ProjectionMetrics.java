package com.flagship.order_ledger.observability;

import com.flagship.order_ledger.eventstore.EventStore;
import com.flagship.order_ledger.eventstore.OrderEventRepository;
import com.flagship.order_ledger.projection.ApplyOutcome;
import com.flagship.order_ledger.projection.OrderSummaryRepository;
import com.flagship.order_ledger.projection.ProjectionLag;
import com.flagship.order_ledger.projection.QuarantinedEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the read side and the relay.
 *
 * Gauges read cached values that {@link MetricsScheduler} refreshes, so a
 * scrape never hits the database.
 */
@Component
@Slf4j
public class ProjectionMetrics {

    private final EventStore eventStore;
    private final OrderSummaryRepository summaryRepository;
    private final QuarantinedEventRepository quarantineRepository;
    private final OrderEventRepository eventRepository;
    private final MeterRegistry meterRegistry;
    private final boolean relayEnabled;
    private final int relayMaxAttempts;

    private final AtomicLong projectionLag = new AtomicLong(0);
    private final AtomicLong aggregatesBehind = new AtomicLong(0);
    private final AtomicLong quarantineSize = new AtomicLong(0);
    private final AtomicLong relayBacklog = new AtomicLong(0);
    private final AtomicLong relayBacklogAgeSeconds = new AtomicLong(0);
    private final AtomicLong relayDeadLettered = new AtomicLong(0);

    public ProjectionMetrics(EventStore eventStore,
                             OrderSummaryRepository summaryRepository,
                             QuarantinedEventRepository quarantineRepository,
                             OrderEventRepository eventRepository,
                             MeterRegistry meterRegistry,
                             @Value("${orders.relay.kafka.enabled:false}") boolean relayEnabled,
                             @Value("${orders.relay.max-attempts:5}") int relayMaxAttempts) {
        this.eventStore = eventStore;
        this.summaryRepository = summaryRepository;
        this.quarantineRepository = quarantineRepository;
        this.eventRepository = eventRepository;
        this.meterRegistry = meterRegistry;
        this.relayEnabled = relayEnabled;
        this.relayMaxAttempts = relayMaxAttempts;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("orders.projection.lag.events", projectionLag, AtomicLong::get)
                .description("Events appended but not yet reflected in order summaries")
                .register(meterRegistry);

        Gauge.builder("orders.projection.lag.aggregates", aggregatesBehind, AtomicLong::get)
                .description("Orders whose summary is behind their stream")
                .register(meterRegistry);

        Gauge.builder("orders.projection.quarantine.size", quarantineSize, AtomicLong::get)
                .description("Events the projection gave up on")
                .register(meterRegistry);

        if (relayEnabled) {
            Gauge.builder("orders.relay.backlog.size", relayBacklog, AtomicLong::get)
                    .description("Events not yet relayed to Kafka")
                    .register(meterRegistry);

            Gauge.builder("orders.relay.backlog.age.seconds", relayBacklogAgeSeconds, AtomicLong::get)
                    .description("Age of the oldest unrelayed event in seconds")
                    .register(meterRegistry);

            Gauge.builder("orders.relay.dead_lettered", relayDeadLettered, AtomicLong::get)
                    .description("Events that exceeded the relay's max attempts")
                    .register(meterRegistry);
        }

        log.info("Projection metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached gauge values. Called periodically by the scheduler.
     */
    public void refreshMetrics() {
        try {
            Map<UUID, Long> heads = eventStore.streamHeads();
            Map<UUID, Long> behind = ProjectionLag.behind(heads, summaryRepository.findAllWatermarks(),
                    quarantineRepository.findAllPositions());
            projectionLag.set(ProjectionLag.totalLag(heads, behind));
            aggregatesBehind.set(behind.size());
            quarantineSize.set(quarantineRepository.count());

            if (relayEnabled) {
                relayBacklog.set(eventRepository.countUnrelayed());
                relayBacklogAgeSeconds.set(eventRepository.findOldestUnrelayedAppendedAt()
                        .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                        .orElse(0L));
                relayDeadLettered.set(eventRepository.countDeadLettered(relayMaxAttempts));
            }

            log.debug("Projection metrics refreshed: lag={}, behind={}, quarantined={}",
                    projectionLag.get(), aggregatesBehind.get(), quarantineSize.get());

        } catch (Exception e) {
            log.warn("Failed to refresh projection metrics: {}", e.getMessage());
        }
    }

    public void recordOutcome(ApplyOutcome outcome) {
        meterRegistry.counter("orders.projection.events",
                "outcome", outcome.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordGap() {
        meterRegistry.counter("orders.projection.gaps").increment();
    }

    public void recordApplyFailure(String eventType) {
        meterRegistry.counter("orders.projection.failures",
                "event_type", eventType
        ).increment();
    }

    public void recordRelayed(String eventType) {
        meterRegistry.counter("orders.relay.events",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordRelayFailed(String eventType) {
        meterRegistry.counter("orders.relay.events",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }
}
