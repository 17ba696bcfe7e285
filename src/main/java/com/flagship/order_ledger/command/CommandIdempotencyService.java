package com.flagship.order_ledger.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers the first result of a keyed command.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable or disabled)
 * 2. Fall back to the command_receipts table, which is the source of truth
 * 3. Write both, Redis best effort
 *
 * The order stream itself is the last line of defence: a keyed create maps
 * to a fixed order ID, so a repeat that slips past both lookups is a no-op.
 */
@Service
@Slf4j
public class CommandIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "orders:idempotency:";

    private final CommandReceiptRepository receiptRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration redisTtl;

    public CommandIdempotencyService(CommandReceiptRepository receiptRepository,
                                     Optional<StringRedisTemplate> redisTemplate,
                                     @Value("${orders.idempotency.redis.enabled:true}") boolean redisEnabled,
                                     @Value("${orders.idempotency.redis.ttl-hours:168}") long ttlHours) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
        this.redisTtl = Duration.ofHours(ttlHours);
    }

    /**
     * @return the receipt recorded for the key, or empty if the key is new
     */
    public Optional<CommandReceipt> find(String idempotencyKey, CommandType commandType) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(decode(idempotencyKey, commandType, cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<CommandReceipt> stored = receiptRepository.findById(idempotencyKey)
                .map(CommandReceiptEntity::toDomain);
        stored.ifPresent(receipt -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(receipt);
        });
        return stored;
    }

    /**
     * Records the result under the key unless another request got there first.
     *
     * @return the receipt that is now on record, which may be the earlier one
     */
    public CommandReceipt remember(String idempotencyKey, CommandType commandType, CommandResult result) {
        requireKey(idempotencyKey);

        CommandReceipt receipt = CommandReceipt.of(idempotencyKey, commandType, result);
        CommandReceipt recorded;
        try {
            recorded = receiptRepository.findById(idempotencyKey)
                    .map(CommandReceiptEntity::toDomain)
                    .orElseGet(() -> receiptRepository.saveAndFlush(CommandReceiptEntity.fromDomain(receipt)).toDomain());
        } catch (DataIntegrityViolationException e) {
            log.debug("Idempotency key {} recorded concurrently, using the first receipt", idempotencyKey);
            recorded = receiptRepository.findById(idempotencyKey)
                    .map(CommandReceiptEntity::toDomain)
                    .orElseThrow(() -> e);
        }
        cache(recorded);
        return recorded;
    }

    private void cache(CommandReceipt receipt) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + receipt.getIdempotencyKey(),
                    receipt.getAggregateId() + ":" + receipt.getResultingVersion(), redisTtl);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static CommandReceipt decode(String idempotencyKey, CommandType commandType, String cached) {
        int separator = cached.lastIndexOf(':');
        return new CommandReceipt(idempotencyKey, commandType,
                UUID.fromString(cached.substring(0, separator)),
                Long.parseLong(cached.substring(separator + 1)),
                Instant.now());
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
