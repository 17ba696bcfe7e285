package com.flagship.order_ledger.projection;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Compares stream heads against read-model watermarks.
 */
public final class ProjectionLag {

    private ProjectionLag() {
        // Utility class
    }

    /**
     * Aggregates whose stream is ahead of their summary row.
     *
     * An aggregate is not behind when every event past its watermark is
     * quarantined: catch-up cannot move it and it waits for a reconcile.
     *
     * @return the row's watermark (0 when there is no row) keyed by aggregate ID
     */
    public static Map<UUID, Long> behind(Map<UUID, Long> streamHeads,
                                         List<OrderSummaryRepository.Watermark> watermarks,
                                         List<QuarantinedEventRepository.Position> quarantined) {
        Map<UUID, Long> applied = new HashMap<>();
        for (OrderSummaryRepository.Watermark watermark : watermarks) {
            applied.put(watermark.getId(), watermark.getLastAppliedSequence());
        }
        Map<UUID, Set<Long>> parked = new HashMap<>();
        for (QuarantinedEventRepository.Position position : quarantined) {
            parked.computeIfAbsent(position.getAggregateId(), id -> new HashSet<>()).add(position.getSequenceNumber());
        }

        Map<UUID, Long> behind = new HashMap<>();
        streamHeads.forEach((aggregateId, head) -> {
            long last = applied.getOrDefault(aggregateId, 0L);
            if (head > last && hasPendingEvent(last, head, parked.getOrDefault(aggregateId, Set.of()))) {
                behind.put(aggregateId, last);
            }
        });
        return behind;
    }

    private static boolean hasPendingEvent(long last, long head, Set<Long> quarantinedSequences) {
        for (long sequence = last + 1; sequence <= head; sequence++) {
            if (!quarantinedSequences.contains(sequence)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Total number of events not yet reflected in the read model.
     */
    public static long totalLag(Map<UUID, Long> streamHeads, Map<UUID, Long> behind) {
        long lag = 0;
        for (Map.Entry<UUID, Long> entry : behind.entrySet()) {
            lag += streamHeads.get(entry.getKey()) - entry.getValue();
        }
        return lag;
    }
}
