package com.flagship.shipping_workflow.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.account.BalanceService;
import com.flagship.shipping_workflow.account.InsufficientBalanceException;
import com.flagship.shipping_workflow.payment.CompletionRequest;
import com.flagship.shipping_workflow.payment.CompletionTrigger;
import com.flagship.shipping_workflow.payment.PaymentKind;
import com.flagship.shipping_workflow.payment.PaymentRecord;
import com.flagship.shipping_workflow.payment.PaymentRecordService;
import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionField;
import com.flagship.shipping_workflow.shipment.ShipmentDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a finished session into an order and takes payment for it.
 *
 * Placement is idempotent on the session's order correlation id: replaying
 * the final step returns the order already placed without charging again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    static final String BALANCE_REFERENCE_PREFIX = "balance:";

    private final OrderRepository orderRepository;
    private final BalanceService balanceService;
    private final PaymentRecordService paymentRecordService;
    private final CompletionTrigger completionTrigger;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Places the order for a session whose quote has been selected.
     *
     * @throws InsufficientBalanceException if a balance payment is not covered
     * @throws com.flagship.shipping_workflow.payment.PaymentProviderException if the invoice cannot be opened
     * @throws IllegalStateException if the session has no selected quote
     */
    @Transactional
    public OrderPlacement placeOrder(Session session, ShipmentDetails shipment, PaymentMethod method) {
        String correlationId = session.getOrderCorrelationId();

        Optional<OrderEntity> existing = orderRepository.findByOrderCorrelationId(correlationId);
        if (existing.isPresent()) {
            Order order = existing.get().toDomain();
            log.info("Order already placed: orderCorrelationId={}, orderId={}", correlationId, order.getId());
            PaymentRecord invoice = order.getPaymentMethod() == PaymentMethod.INVOICE && !order.isPaid()
                    ? paymentRecordService.openOrderInvoice(order.getUserKey(), correlationId, order.getAmount())
                    : null;
            return new OrderPlacement(order, invoice);
        }

        String quoteId = required(session, SessionField.SELECTED_QUOTE_ID);
        BigDecimal amount = new BigDecimal(required(session, SessionField.SELECTED_AMOUNT));
        String userKey = session.getUserKey();

        if (method == PaymentMethod.BALANCE && !balanceService.tryDebit(userKey, amount)) {
            throw new InsufficientBalanceException(userKey, balanceService.getBalance(userKey), amount);
        }

        Instant now = clock.instant();
        Order order = Order.builder()
                .id(UUID.randomUUID())
                .orderCorrelationId(correlationId)
                .userKey(userKey)
                .paymentMethod(method)
                .paymentStatus(method == PaymentMethod.BALANCE ? OrderPaymentStatus.PAID : OrderPaymentStatus.UNPAID)
                .quoteId(quoteId)
                .carrier(required(session, SessionField.SELECTED_CARRIER))
                .service(session.field(SessionField.SELECTED_SERVICE).orElse(null))
                .amount(amount)
                .shipment(toJson(shipment))
                .createdAt(now)
                .updatedAt(now)
                .build();
        orderRepository.save(OrderEntity.fromDomain(order));

        log.info("Order placed: orderCorrelationId={}, orderId={}, method={}, amount={}",
                correlationId, order.getId(), method, amount);

        if (method == PaymentMethod.BALANCE) {
            completionTrigger.fire(new CompletionRequest(order.getId(), correlationId, userKey,
                    PaymentKind.ORDER_PAYMENT, BALANCE_REFERENCE_PREFIX + order.getId(), amount));
            return new OrderPlacement(order, null);
        }

        PaymentRecord invoice = paymentRecordService.openOrderInvoice(userKey, correlationId, amount);
        return new OrderPlacement(order, invoice);
    }

    /**
     * Marks the order paid.
     *
     * @return the paid order, or empty if it is unknown or was already paid
     */
    @Transactional
    public Optional<Order> markPaid(String orderCorrelationId) {
        int updated = orderRepository.markPaid(orderCorrelationId, clock.instant());
        if (updated == 0) {
            return Optional.empty();
        }
        return orderRepository.findByOrderCorrelationId(orderCorrelationId).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByOrderCorrelationId(String orderCorrelationId) {
        return orderRepository.findByOrderCorrelationId(orderCorrelationId).map(OrderEntity::toDomain);
    }

    private static String required(Session session, SessionField field) {
        return session.field(field)
                .orElseThrow(() -> new IllegalStateException("Session has no " + field.getKey()));
    }

    private String toJson(ShipmentDetails shipment) {
        try {
            return objectMapper.writeValueAsString(shipment);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize shipment", e);
        }
    }
}
