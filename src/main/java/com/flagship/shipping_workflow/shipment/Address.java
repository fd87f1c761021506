package com.flagship.shipping_workflow.shipment;

import lombok.Value;

/**
 * Postal address of a sender or recipient. {@code line2} and {@code phone}
 * may be null when the user skipped them.
 */
@Value
public class Address {
    String name;
    String line1;
    String line2;
    String city;
    String state;
    String zip;
    String phone;
}
