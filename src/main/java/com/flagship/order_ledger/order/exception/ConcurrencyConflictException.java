package com.flagship.order_ledger.order.exception;

import java.util.UUID;

/**
 * The expected version was stale at append time.
 *
 * The command handler retries these up to a bound. Once the bound is
 * exhausted the exception reaches the caller unchanged.
 */
public class ConcurrencyConflictException extends RuntimeException {

    /**
     * Used when a concurrent writer was detected by the store's uniqueness
     * constraint and the winning version was never observed.
     */
    public static final long UNKNOWN_VERSION = -1L;

    private final UUID aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
        this(aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        super(String.format("Concurrent modification of order %s: expected version %d, actual %s",
                aggregateId, expectedVersion,
                actualVersion == UNKNOWN_VERSION ? "unknown" : String.valueOf(actualVersion)), cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
