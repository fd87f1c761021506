package com.flagship.shipping_workflow.quote;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Short-lived store of quote lists keyed by shipment fingerprint.
 *
 * Purely a store: it never fetches on a miss. An entry is a miss once its TTL
 * has elapsed.
 */
public interface QuoteCache {

    Optional<List<Quote>> get(String fingerprint);

    void set(String fingerprint, List<Quote> quotes, Duration ttl);

    void delete(String fingerprint);
}
