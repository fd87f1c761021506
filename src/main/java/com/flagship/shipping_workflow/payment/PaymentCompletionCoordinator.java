package com.flagship.shipping_workflow.payment;

import com.flagship.shipping_workflow.account.BalanceService;
import com.flagship.shipping_workflow.observability.CorrelationContext;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import com.flagship.shipping_workflow.order.Order;
import com.flagship.shipping_workflow.order.OrderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Applies provider payment notifications exactly once.
 *
 * Deliveries are at-least-once and may race: the webhook and the Kafka
 * consumer can see the same event, and a provider may resend it. The record's
 * status transition is a conditional update, so exactly one delivery wins;
 * the winner credits the balance or marks the order paid and fires the
 * completion trigger in the same transaction. Everyone else gets
 * {@link PaymentOutcome#DUPLICATE_IGNORED}.
 *
 * Paid events are also honoured for FAILED or EXPIRED records (late payment).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCompletionCoordinator {

    private final PaymentRecordRepository repository;
    private final BalanceService balanceService;
    private final OrderService orderService;
    private final CompletionTrigger completionTrigger;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    @Transactional
    public PaymentOutcome apply(PaymentEvent event) {
        String externalReference = event.getExternalReference();
        if (externalReference == null || externalReference.isBlank()) {
            log.warn("Payment event without external reference rejected");
            return record(null, PaymentOutcome.REJECTED);
        }

        try (MDC.MDCCloseable ignored = CorrelationContext.payment(externalReference)) {
            Optional<PaymentStatus> reported = PaymentStatus.fromProvider(event.getStatus());
            if (reported.isEmpty()) {
                log.warn("Payment event with unknown status rejected: status={}", event.getStatus());
                return record(event.getKind(), PaymentOutcome.REJECTED);
            }

            Optional<PaymentRecord> found = repository.findByExternalReference(externalReference)
                    .map(PaymentRecordEntity::toDomain);
            if (found.isEmpty()) {
                log.warn("Payment event for unknown reference rejected: status={}", event.getStatus());
                return record(event.getKind(), PaymentOutcome.REJECTED);
            }

            PaymentRecord paymentRecord = found.get();
            if (event.getKind() != null && event.getKind() != paymentRecord.getKind()) {
                log.warn("Payment event kind {} differs from record kind {}, using the record",
                        event.getKind(), paymentRecord.getKind());
            }
            if (paymentRecord.isPaid()) {
                log.info("Payment already applied, ignoring duplicate: status={}", event.getStatus());
                return record(paymentRecord.getKind(), PaymentOutcome.DUPLICATE_IGNORED);
            }

            return switch (reported.get()) {
                case PAID -> applyPaid(paymentRecord, event.getAmount());
                case FAILED, EXPIRED -> applyClosed(paymentRecord, reported.get());
                case PENDING -> record(paymentRecord.getKind(), PaymentOutcome.DUPLICATE_IGNORED);
            };
        }
    }

    private PaymentOutcome applyPaid(PaymentRecord paymentRecord, BigDecimal reportedAmount) {
        BigDecimal paidAmount = reportedAmount != null && reportedAmount.signum() > 0
                ? reportedAmount
                : paymentRecord.getRequestedAmount();

        int won = repository.markPaid(paymentRecord.getExternalReference(), paidAmount, clock.instant());
        if (won == 0) {
            log.info("Concurrent delivery already applied the payment");
            return record(paymentRecord.getKind(), PaymentOutcome.DUPLICATE_IGNORED);
        }

        switch (paymentRecord.getKind()) {
            case BALANCE_TOPUP -> {
                BigDecimal balance = balanceService.credit(paymentRecord.getUserKey(), paidAmount);
                log.info("Top-up applied: userKey={}, amount={}, balance={}",
                        paymentRecord.getUserKey(), paidAmount, balance);
                completionTrigger.fire(new CompletionRequest(null, null, paymentRecord.getUserKey(),
                        PaymentKind.BALANCE_TOPUP, paymentRecord.getExternalReference(), paidAmount));
            }
            case ORDER_PAYMENT -> {
                Optional<Order> paid = orderService.markPaid(paymentRecord.getOrderCorrelationId());
                if (paid.isPresent()) {
                    log.info("Order paid: orderCorrelationId={}, amount={}",
                            paymentRecord.getOrderCorrelationId(), paidAmount);
                    completionTrigger.fire(new CompletionRequest(paid.get().getId(),
                            paymentRecord.getOrderCorrelationId(), paymentRecord.getUserKey(),
                            PaymentKind.ORDER_PAYMENT, paymentRecord.getExternalReference(), paidAmount));
                } else {
                    log.warn("Order payment recorded but order {} is unknown or already paid",
                            paymentRecord.getOrderCorrelationId());
                }
            }
        }
        return record(paymentRecord.getKind(), PaymentOutcome.APPLIED);
    }

    private PaymentOutcome applyClosed(PaymentRecord paymentRecord, PaymentStatus target) {
        int closed = repository.closePending(paymentRecord.getExternalReference(), target, clock.instant());
        if (closed == 0) {
            return record(paymentRecord.getKind(), PaymentOutcome.DUPLICATE_IGNORED);
        }
        log.info("Payment closed without settlement: status={}", target);
        return record(paymentRecord.getKind(), PaymentOutcome.APPLIED);
    }

    private PaymentOutcome record(PaymentKind kind, PaymentOutcome outcome) {
        metrics.recordPaymentOutcome(kind != null ? kind.name() : null, outcome.name());
        return outcome;
    }
}
