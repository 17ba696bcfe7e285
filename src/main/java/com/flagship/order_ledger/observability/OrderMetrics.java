package com.flagship.order_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for the command path.
 *
 * Metrics exposed:
 * - orders.commands: Counter per command type and outcome
 * - orders.commands.latency: Timer per command type
 * - orders.concurrency.retries: Counter of conflict retries
 * - orders.concurrency.exhausted: Counter of commands that ran out of retries
 * - idempotency.cache: Counter of idempotency key hits and misses
 */
@Component
public class OrderMetrics {

    public static final String OUTCOME_APPENDED = "appended";
    public static final String OUTCOME_NO_OP = "no_op";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_CONFLICT = "conflict";
    public static final String OUTCOME_CORRUPT = "corrupt";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;
    private final Counter conflictsExhausted;

    public OrderMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.conflictsExhausted = Counter.builder("orders.concurrency.exhausted")
                .description("Commands that surfaced a concurrency conflict after all retries")
                .register(registry);
    }

    public void recordCommand(String commandType, String outcome, Duration duration) {
        registry.counter("orders.commands",
                "command", sanitizeTag(commandType),
                "outcome", outcome
        ).increment();
        registry.timer("orders.commands.latency",
                "command", sanitizeTag(commandType)
        ).record(duration);
    }

    public void recordConcurrencyRetry(String commandType) {
        registry.counter("orders.concurrency.retries",
                "command", sanitizeTag(commandType)
        ).increment();
    }

    public void recordConflictExhausted() {
        conflictsExhausted.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
