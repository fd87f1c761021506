package com.flagship.shipping_workflow.payment;

/**
 * External payment gateway that issues invoices and later reports their
 * status through {@link PaymentEvent}s.
 */
public interface PaymentProvider {

    /**
     * @throws PaymentProviderException if the invoice could not be created
     */
    Invoice createInvoice(InvoiceRequest request);
}
