package com.flagship.order_ledger.observability;

import com.flagship.order_ledger.eventstore.OrderEventRepository;
import com.flagship.order_ledger.projection.QuarantinedEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the order ledger's background machinery.
 */
public class HealthIndicators {

    /**
     * Any quarantined event means an order summary is stuck until an operator reconciles it.
     */
    @Component("projectionQuarantineHealth")
    public static class ProjectionQuarantineHealthIndicator implements HealthIndicator {

        private final QuarantinedEventRepository quarantineRepository;
        private final long criticalThreshold;

        public ProjectionQuarantineHealthIndicator(
                QuarantinedEventRepository quarantineRepository,
                @Value("${orders.projection.quarantine.critical-threshold:100}") long criticalThreshold) {
            this.quarantineRepository = quarantineRepository;
            this.criticalThreshold = criticalThreshold;
        }

        @Override
        public Health health() {
            try {
                long quarantined = quarantineRepository.count();

                Health.Builder builder = quarantined == 0
                        ? Health.up()
                        : quarantined < criticalThreshold
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("quarantined", quarantined)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Health of the Kafka relay backlog.
     */
    @Component("eventRelayHealth")
    @ConditionalOnProperty(name = "orders.relay.kafka.enabled", havingValue = "true")
    public static class EventRelayHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OrderEventRepository eventRepository;
        private final int maxAttempts;

        public EventRelayHealthIndicator(OrderEventRepository eventRepository,
                                         @Value("${orders.relay.max-attempts:5}") int maxAttempts) {
            this.eventRepository = eventRepository;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = eventRepository.countUnrelayed();
                long deadLettered = eventRepository.countDeadLettered(maxAttempts);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD && deadLettered == 0
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only speeds up idempotency lookups; the database is the fallback.
     */
    @Component("redisHealth")
    @ConditionalOnProperty(name = "orders.idempotency.redis.enabled", havingValue = "true", matchIfMissing = true)
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                var connection = connectionFactory.getConnection();
                try {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                } finally {
                    connection.close();
                }

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency lookups fall back to the database")
                    .build();
        }
    }
}
