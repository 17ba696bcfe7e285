package com.flagship.order_ledger.projection;

import java.util.Optional;
import java.util.UUID;

/**
 * Source of customer display names for the order summary.
 */
public interface CustomerDirectory {

    Optional<String> findName(UUID customerId);

    /**
     * The customer's name, or the ID as text when the customer is unknown.
     */
    default String displayName(UUID customerId) {
        return findName(customerId).orElse(customerId.toString());
    }
}
