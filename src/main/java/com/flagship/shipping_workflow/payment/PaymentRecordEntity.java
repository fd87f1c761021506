package com.flagship.shipping_workflow.payment;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payment records.
 *
 * Status changes after creation go through the conditional updates in
 * {@link PaymentRecordRepository}, never through entity setters, so two
 * deliveries of the same event cannot both win.
 */
@Entity
@Table(name = "payment_records")
@Getter
@Setter
@NoArgsConstructor
public class PaymentRecordEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "external_reference", nullable = false, unique = true, updatable = false, length = 128)
    private String externalReference;

    @Column(name = "user_key", nullable = false, length = 128)
    private String userKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private PaymentKind kind;

    @Column(name = "requested_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal requestedAmount;

    @Column(name = "paid_amount", precision = 19, scale = 4)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "order_correlation_id", length = 64)
    private String orderCorrelationId;

    @Column(name = "payment_url", length = 512)
    private String paymentUrl;

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
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static PaymentRecordEntity fromDomain(PaymentRecord record) {
        PaymentRecordEntity entity = new PaymentRecordEntity();
        entity.setId(record.getId());
        entity.setExternalReference(record.getExternalReference());
        entity.setUserKey(record.getUserKey());
        entity.setKind(record.getKind());
        entity.setRequestedAmount(record.getRequestedAmount());
        entity.setPaidAmount(record.getPaidAmount());
        entity.setStatus(record.getStatus());
        entity.setOrderCorrelationId(record.getOrderCorrelationId());
        entity.setPaymentUrl(record.getPaymentUrl());
        entity.setCreatedAt(record.getCreatedAt());
        entity.setUpdatedAt(record.getUpdatedAt());
        return entity;
    }

    public PaymentRecord toDomain() {
        return PaymentRecord.builder()
                .id(id)
                .externalReference(externalReference)
                .userKey(userKey)
                .kind(kind)
                .requestedAmount(requestedAmount)
                .paidAmount(paidAmount)
                .status(status)
                .orderCorrelationId(orderCorrelationId)
                .paymentUrl(paymentUrl)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
