package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.query.dto.OrderSummaryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints for repairing a single order's summary.
 */
@RestController
@RequestMapping("/api/orders/{id}/projection")
@RequiredArgsConstructor
@Slf4j
public class ProjectionAdminController {

    private final OrderSummaryProjection projection;

    /**
     * POST /api/orders/{id}/projection/rebuild
     *
     * @return 200 with the rebuilt summary, or 404 if the stream yields no row
     */
    @PostMapping("/rebuild")
    public ResponseEntity<OrderSummaryResponse> rebuild(@PathVariable("id") UUID id) {
        log.info("Rebuild requested for order {}", id);
        return projection.rebuild(id)
                .map(summary -> ResponseEntity.ok(OrderSummaryResponse.from(summary)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/orders/{id}/projection/reconcile
     *
     * Clears the order's quarantined events and rebuilds.
     */
    @PostMapping("/reconcile")
    public ResponseEntity<OrderSummaryResponse> reconcile(@PathVariable("id") UUID id) {
        log.info("Reconcile requested for order {}", id);
        return projection.reconcile(id)
                .map(summary -> ResponseEntity.ok(OrderSummaryResponse.from(summary)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/quarantine")
    public List<QuarantinedEvent> quarantine(@PathVariable("id") UUID id) {
        return projection.findQuarantined(id);
    }
}
