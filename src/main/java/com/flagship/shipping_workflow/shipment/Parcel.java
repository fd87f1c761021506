package com.flagship.shipping_workflow.shipment;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Parcel weight in pounds and dimensions in inches.
 */
@Value
public class Parcel {
    BigDecimal weight;
    BigDecimal length;
    BigDecimal width;
    BigDecimal height;
}
