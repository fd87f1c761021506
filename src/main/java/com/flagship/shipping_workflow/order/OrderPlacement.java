package com.flagship.shipping_workflow.order;

import com.flagship.shipping_workflow.payment.PaymentRecord;
import lombok.Value;

import java.util.Optional;

/**
 * Result of placing an order: the order plus, for invoice payments, the
 * pending payment record carrying the invoice link.
 */
@Value
public class OrderPlacement {
    Order order;
    PaymentRecord invoice;

    public Optional<String> paymentUrl() {
        return invoice == null ? Optional.empty() : Optional.ofNullable(invoice.getPaymentUrl());
    }
}
