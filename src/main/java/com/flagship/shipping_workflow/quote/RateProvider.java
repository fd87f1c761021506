package com.flagship.shipping_workflow.quote;

import com.flagship.shipping_workflow.shipment.ShipmentDetails;

import java.util.List;

/**
 * External carrier-rate lookup.
 */
public interface RateProvider {

    /**
     * @throws RateFetchException if the provider cannot produce quotes
     */
    List<Quote> fetchQuotes(ShipmentDetails shipment);
}
