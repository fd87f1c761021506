package com.flagship.shipping_workflow.payment;

/**
 * Downstream action started exactly once when a payment settles (shipment
 * label purchase, user notification).
 *
 * Called inside the transaction that recorded the payment, so it must not
 * commit anything on its own.
 */
public interface CompletionTrigger {

    void fire(CompletionRequest request);
}
