package com.flagship.order_ledger.command;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for concurrency-conflict retries.
 *
 * delay(n) = min(initialBackoff × 2^(n-1), maxBackoff), then halved and topped
 * up with a random share of the other half so that competing writers spread out.
 */
@Component
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(@Value("${orders.command.retry.max-attempts:5}") int maxAttempts,
                       @Value("${orders.command.retry.initial-backoff-ms:10}") long initialBackoffMs,
                       @Value("${orders.command.retry.max-backoff-ms:200}") long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Backoff bounds must satisfy 0 <= initial <= max");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Duration.ofMillis(initialBackoffMs);
        this.maxBackoff = Duration.ofMillis(maxBackoffMs);
    }

    /**
     * Delay before the retry that follows the given failed attempt (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        long ceiling = ceilingAfter(failedAttempt);
        if (ceiling == 0) {
            return Duration.ZERO;
        }
        long half = ceiling / 2;
        return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(ceiling - half + 1));
    }

    /**
     * Upper bound of {@link #backoffAfter(int)}, without jitter.
     */
    public long ceilingAfter(int failedAttempt) {
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long delay = initialBackoff.toMillis() << shift;
        return Math.min(delay, maxBackoff.toMillis());
    }

    public boolean hasAttemptsLeft(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
