package com.flagship.order_ledger.query;

import com.flagship.order_ledger.order.OrderStatus;
import com.flagship.order_ledger.order.exception.OrderValidationException;
import com.flagship.order_ledger.query.dto.OrderSummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for the order read model.
 *
 * A 404 right after a create is normal: the summary appears once the
 * projection has applied the order's first event.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderQueryController {

    private final OrderQueryService queryService;

    @GetMapping("/{id}")
    public ResponseEntity<OrderSummaryResponse> getOrder(@PathVariable("id") UUID id) {
        return queryService.findById(id)
            .map(summary -> ResponseEntity.ok(OrderSummaryResponse.from(summary)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<OrderSummaryResponse> searchOrders(
            @RequestParam(value = "customerId", required = false) UUID customerId,
            @RequestParam(value = "status", required = false) OrderStatus status,
            @RequestParam(value = "limit", defaultValue = "" + OrderSummaryFilter.DEFAULT_LIMIT) int limit) {
        OrderSummaryFilter filter;
        try {
            filter = new OrderSummaryFilter(customerId, status, limit);
        } catch (IllegalArgumentException e) {
            throw new OrderValidationException(e.getMessage());
        }
        return queryService.search(filter).stream()
            .map(OrderSummaryResponse::from)
            .toList();
    }
}
