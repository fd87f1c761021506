package com.flagship.shipping_workflow.order;

public enum OrderPaymentStatus {
    UNPAID,
    PAID
}
