package com.flagship.shipping_workflow.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for orders.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_correlation_id", nullable = false, unique = true, updatable = false, length = 64)
    private String orderCorrelationId;

    @Column(name = "user_key", nullable = false, length = 128)
    private String userKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private OrderPaymentStatus paymentStatus;

    @Column(name = "quote_id", nullable = false, length = 128)
    private String quoteId;

    @Column(name = "carrier", nullable = false, length = 64)
    private String carrier;

    @Column(name = "service", length = 128)
    private String service;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "shipment", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String shipment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static OrderEntity fromDomain(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setId(order.getId());
        entity.setOrderCorrelationId(order.getOrderCorrelationId());
        entity.setUserKey(order.getUserKey());
        entity.setPaymentMethod(order.getPaymentMethod());
        entity.setPaymentStatus(order.getPaymentStatus());
        entity.setQuoteId(order.getQuoteId());
        entity.setCarrier(order.getCarrier());
        entity.setService(order.getService());
        entity.setAmount(order.getAmount());
        entity.setShipment(order.getShipment());
        entity.setCreatedAt(order.getCreatedAt());
        entity.setUpdatedAt(order.getUpdatedAt());
        return entity;
    }

    public Order toDomain() {
        return Order.builder()
                .id(id)
                .orderCorrelationId(orderCorrelationId)
                .userKey(userKey)
                .paymentMethod(paymentMethod)
                .paymentStatus(paymentStatus)
                .quoteId(quoteId)
                .carrier(carrier)
                .service(service)
                .amount(amount)
                .shipment(shipment)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
