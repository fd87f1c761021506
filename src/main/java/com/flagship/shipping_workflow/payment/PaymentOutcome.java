package com.flagship.shipping_workflow.payment;

/**
 * Result of applying one provider payment event.
 */
public enum PaymentOutcome {
    /** The event changed state. */
    APPLIED,
    /** The event was already reflected; nothing changed. */
    DUPLICATE_IGNORED,
    /** The event references no known payment or carries an unknown status. */
    REJECTED
}
