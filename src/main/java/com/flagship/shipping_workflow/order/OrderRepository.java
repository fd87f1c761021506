package com.flagship.shipping_workflow.order;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    Optional<OrderEntity> findByOrderCorrelationId(String orderCorrelationId);

    /**
     * Marks an unpaid order as paid. Returns 0 if the order is unknown or
     * already paid.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE OrderEntity o
        SET o.paymentStatus = com.flagship.shipping_workflow.order.OrderPaymentStatus.PAID,
            o.updatedAt = :now
        WHERE o.orderCorrelationId = :orderCorrelationId
          AND o.paymentStatus = com.flagship.shipping_workflow.order.OrderPaymentStatus.UNPAID
        """)
    int markPaid(@Param("orderCorrelationId") String orderCorrelationId, @Param("now") Instant now);
}
