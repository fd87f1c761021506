package com.flagship.shipping_workflow.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for payment records.
 *
 * Status transitions are conditional single-statement updates; the returned
 * row count tells the caller whether it won the transition.
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecordEntity, UUID> {

    Optional<PaymentRecordEntity> findByExternalReference(String externalReference);

    Optional<PaymentRecordEntity> findFirstByOrderCorrelationIdAndKindOrderByCreatedAtDesc(
            String orderCorrelationId, PaymentKind kind);

    /**
     * Marks a not-yet-paid record as paid.
     *
     * @return 1 if this call made the transition, 0 if the record was already paid
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE PaymentRecordEntity p
        SET p.status = com.flagship.shipping_workflow.payment.PaymentStatus.PAID,
            p.paidAmount = :paidAmount,
            p.updatedAt = :now
        WHERE p.externalReference = :externalReference
          AND p.status <> com.flagship.shipping_workflow.payment.PaymentStatus.PAID
        """)
    int markPaid(@Param("externalReference") String externalReference,
                 @Param("paidAmount") BigDecimal paidAmount,
                 @Param("now") Instant now);

    /**
     * Moves a pending record to {@code target} (FAILED or EXPIRED).
     *
     * @return 1 if this call made the transition, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE PaymentRecordEntity p
        SET p.status = :target, p.updatedAt = :now
        WHERE p.externalReference = :externalReference
          AND p.status = com.flagship.shipping_workflow.payment.PaymentStatus.PENDING
        """)
    int closePending(@Param("externalReference") String externalReference,
                     @Param("target") PaymentStatus target,
                     @Param("now") Instant now);

    /**
     * Expires every pending record created before {@code cutoff}.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE PaymentRecordEntity p
        SET p.status = com.flagship.shipping_workflow.payment.PaymentStatus.EXPIRED, p.updatedAt = :now
        WHERE p.status = com.flagship.shipping_workflow.payment.PaymentStatus.PENDING
          AND p.createdAt < :cutoff
        """)
    int expirePendingCreatedBefore(@Param("cutoff") Instant cutoff, @Param("now") Instant now);

    long countByStatus(PaymentStatus status);
}
