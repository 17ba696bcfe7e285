package com.flagship.order_ledger.projection;

import com.flagship.order_ledger.order.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OrderSummaryRepository extends JpaRepository<OrderSummaryEntity, UUID> {

    List<OrderSummaryEntity> findByCustomerIdAndStatusOrderByCreatedAtDesc(UUID customerId, OrderStatus status,
                                                                           Pageable pageable);

    List<OrderSummaryEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId, Pageable pageable);

    List<OrderSummaryEntity> findByStatusOrderByCreatedAtDesc(OrderStatus status, Pageable pageable);

    List<OrderSummaryEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Watermark of every row, for comparing against stream heads.
     */
    @Query("SELECT s.id AS id, s.lastAppliedSequence AS lastAppliedSequence FROM OrderSummaryEntity s")
    List<Watermark> findAllWatermarks();

    interface Watermark {
        UUID getId();

        Long getLastAppliedSequence();
    }
}
