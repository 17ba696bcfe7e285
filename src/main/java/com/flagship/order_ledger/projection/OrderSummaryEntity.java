package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.OrderLine;
import com.flagship.order_ledger.order.OrderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the order summary read model.
 *
 * Written only by {@link OrderSummaryProjection}. The @Version column guards
 * against two projection instances updating the same row at once.
 */
@Entity
@Table(name = "order_summaries", indexes = {
    @Index(name = "idx_order_summaries_customer", columnList = "customer_id"),
    @Index(name = "idx_order_summaries_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
public class OrderSummaryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "currency", nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = OrderLine.AMOUNT_SCALE)
    private BigDecimal totalAmount;

    @Column(name = "item_count", nullable = false)
    private int itemCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_applied_sequence", nullable = false)
    private long lastAppliedSequence;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    public static OrderSummaryEntity fromDomain(OrderSummary summary) {
        OrderSummaryEntity entity = new OrderSummaryEntity();
        entity.setId(summary.getId());
        entity.copyFrom(summary);
        return entity;
    }

    /**
     * Overwrites every projected column with the given row.
     */
    public void copyFrom(OrderSummary summary) {
        if (id != null && !id.equals(summary.getId())) {
            throw new IllegalArgumentException("Cannot copy summary of " + summary.getId() + " onto " + id);
        }
        this.customerId = summary.getCustomerId();
        this.customerName = summary.getCustomerName();
        this.currency = summary.getCurrency();
        // Unnecessary rounding throws: a total the column cannot hold exactly is never stored
        this.totalAmount = summary.getTotalAmount().setScale(OrderLine.AMOUNT_SCALE, RoundingMode.UNNECESSARY);
        this.itemCount = summary.getItemCount();
        this.status = summary.getStatus();
        this.createdAt = summary.getCreatedAt();
        this.updatedAt = summary.getUpdatedAt();
        this.lastAppliedSequence = summary.getLastAppliedSequence();
    }

    public OrderSummary toDomain() {
        return new OrderSummary(
            this.id,
            this.customerId,
            this.customerName,
            this.currency,
            this.totalAmount,
            this.itemCount,
            this.status,
            this.createdAt,
            this.updatedAt,
            this.lastAppliedSequence
        );
    }
}
