package com.flagship.shipping_workflow.payment;

import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Opens invoices with the payment provider and keeps the pending payment
 * records they produce.
 */
@Service
@Slf4j
public class PaymentRecordService {

    private final PaymentRecordRepository repository;
    private final PaymentProvider paymentProvider;
    private final Clock clock;
    private final Duration pendingExpiry;
    private final WorkflowMetrics metrics;

    public PaymentRecordService(PaymentRecordRepository repository,
                                PaymentProvider paymentProvider,
                                Clock clock,
                                WorkflowProperties properties,
                                WorkflowMetrics metrics) {
        this.repository = repository;
        this.paymentProvider = paymentProvider;
        this.clock = clock;
        this.pendingExpiry = properties.getPayments().getPendingExpiry();
        this.metrics = metrics;
    }

    /**
     * Opens a balance top-up invoice for {@code amount}.
     *
     * @throws PaymentProviderException if the provider refuses
     */
    @Transactional
    public PaymentRecord openTopUp(String userKey, BigDecimal amount) {
        requirePositive(amount);
        InvoiceRequest request = new InvoiceRequest(userKey, PaymentKind.BALANCE_TOPUP, amount, null,
                "Balance top-up");
        return persistPending(request, paymentProvider.createInvoice(request));
    }

    /**
     * Opens the invoice paying for an order. A second call for the same order
     * returns the record already opened instead of issuing a new invoice.
     */
    @Transactional
    public PaymentRecord openOrderInvoice(String userKey, String orderCorrelationId, BigDecimal amount) {
        requirePositive(amount);

        Optional<PaymentRecordEntity> existing = repository
                .findFirstByOrderCorrelationIdAndKindOrderByCreatedAtDesc(orderCorrelationId, PaymentKind.ORDER_PAYMENT);
        if (existing.isPresent()) {
            log.info("Order invoice already open: orderCorrelationId={}, externalReference={}",
                    orderCorrelationId, existing.get().getExternalReference());
            return existing.get().toDomain();
        }

        InvoiceRequest request = new InvoiceRequest(userKey, PaymentKind.ORDER_PAYMENT, amount, orderCorrelationId,
                "Shipment " + orderCorrelationId);
        return persistPending(request, paymentProvider.createInvoice(request));
    }

    @Transactional(readOnly = true)
    public Optional<PaymentRecord> findByExternalReference(String externalReference) {
        return repository.findByExternalReference(externalReference).map(PaymentRecordEntity::toDomain);
    }

    /**
     * Expires invoices that stayed pending longer than
     * {@code workflow.payments.pending-expiry}. A later paid event still
     * settles them.
     */
    @Scheduled(fixedRateString = "${workflow.payments.expiry-check-interval-ms:300000}")
    @Transactional
    public void expireStalePending() {
        Instant now = clock.instant();
        int expired = repository.expirePendingCreatedBefore(now.minus(pendingExpiry), now);
        if (expired > 0) {
            log.info("Expired {} stale pending payment record(s)", expired);
            metrics.recordPendingPaymentsExpired(expired);
        }
    }

    private PaymentRecord persistPending(InvoiceRequest request, Invoice invoice) {
        PaymentRecord record = PaymentRecord.pending(request.getUserKey(), request.getKind(), request.getAmount(),
                request.getOrderCorrelationId(), invoice, clock.instant());
        repository.save(PaymentRecordEntity.fromDomain(record));

        log.info("Payment record opened: userKey={}, kind={}, amount={}, externalReference={}",
                record.getUserKey(), record.getKind(), record.getRequestedAmount(), record.getExternalReference());
        return record;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
