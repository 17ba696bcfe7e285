package com.flagship.order_ledger.query;

import com.flagship.order_ledger.projection.OrderSummary;
import com.flagship.order_ledger.projection.OrderSummaryEntity;
import com.flagship.order_ledger.projection.OrderSummaryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to order summaries.
 *
 * Answers from the read model alone and never touches the event store, so
 * results trail the write side by however far the projection is behind.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderQueryService {

    private final OrderSummaryRepository repository;

    /**
     * @return the summary, or empty if the order does not exist or is not projected yet
     */
    public Optional<OrderSummary> findById(UUID orderId) {
        return repository.findById(orderId).map(OrderSummaryEntity::toDomain);
    }

    /**
     * Summaries matching the filter, newest first.
     */
    public List<OrderSummary> search(OrderSummaryFilter filter) {
        Pageable page = PageRequest.of(0, filter.getLimit());

        List<OrderSummaryEntity> rows;
        if (filter.getCustomerId() != null && filter.getStatus() != null) {
            rows = repository.findByCustomerIdAndStatusOrderByCreatedAtDesc(
                    filter.getCustomerId(), filter.getStatus(), page);
        } else if (filter.getCustomerId() != null) {
            rows = repository.findByCustomerIdOrderByCreatedAtDesc(filter.getCustomerId(), page);
        } else if (filter.getStatus() != null) {
            rows = repository.findByStatusOrderByCreatedAtDesc(filter.getStatus(), page);
        } else {
            rows = repository.findAllByOrderByCreatedAtDesc(page);
        }

        return rows.stream()
                .map(OrderSummaryEntity::toDomain)
                .toList();
    }
}
