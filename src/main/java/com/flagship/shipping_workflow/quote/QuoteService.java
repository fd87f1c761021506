package com.flagship.shipping_workflow.quote;

import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import com.flagship.shipping_workflow.shipment.ShipmentDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache-aside access to carrier quotes.
 *
 * A hit returns the cached list without touching the rate provider. A miss
 * fetches, normalizes (priced quotes only, unique ids, cheapest first) and
 * stores the list under the shipment's fingerprint.
 */
@Service
@Slf4j
public class QuoteService {

    private final QuoteCache quoteCache;
    private final RateProvider rateProvider;
    private final WorkflowMetrics metrics;
    private final Duration ttl;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public QuoteService(QuoteCache quoteCache,
                        RateProvider rateProvider,
                        WorkflowMetrics metrics,
                        WorkflowProperties properties) {
        this.quoteCache = quoteCache;
        this.rateProvider = rateProvider;
        this.metrics = metrics;
        this.ttl = properties.getQuotes().getTtl();
    }

    /**
     * Returns quotes for the shipment, from cache when possible.
     *
     * @throws RateFetchException if the provider fails or returns no usable quote
     */
    public List<Quote> quotesFor(ShipmentDetails shipment) {
        String fingerprint = QuoteFingerprint.of(shipment);

        Optional<List<Quote>> cached = quoteCache.get(fingerprint);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            metrics.recordQuoteCacheHit();
            log.debug("Quote cache hit: fingerprint={}, route={}->{}", fingerprint,
                    shipment.getFrom().getZip(), shipment.getTo().getZip());
            return cached.get();
        }

        misses.incrementAndGet();
        metrics.recordQuoteCacheMiss();
        List<Quote> quotes = fetch(shipment);
        quoteCache.set(fingerprint, quotes, ttl);

        log.info("Fetched and cached quotes: fingerprint={}, route={}->{}, count={}",
                fingerprint, shipment.getFrom().getZip(), shipment.getTo().getZip(), quotes.size());
        return quotes;
    }

    /**
     * Returns the cached quotes without fetching on a miss.
     */
    public Optional<List<Quote>> cachedQuotesFor(ShipmentDetails shipment) {
        return quoteCache.get(QuoteFingerprint.of(shipment));
    }

    /**
     * Drops the cached entry for the shipment and fetches anew.
     */
    public List<Quote> refresh(ShipmentDetails shipment) {
        quoteCache.delete(QuoteFingerprint.of(shipment));
        log.info("Quote refresh requested: route={}->{}",
                shipment.getFrom().getZip(), shipment.getTo().getZip());
        return quotesFor(shipment);
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get());
    }

    private List<Quote> fetch(ShipmentDetails shipment) {
        List<Quote> fetched;
        try {
            fetched = rateProvider.fetchQuotes(shipment);
        } catch (RateFetchException e) {
            metrics.recordQuoteFetchFailure();
            throw e;
        } catch (Exception e) {
            metrics.recordQuoteFetchFailure();
            throw new RateFetchException("Rate provider failed: " + e.getMessage(), e);
        }

        List<Quote> normalized = normalize(fetched);
        if (normalized.isEmpty()) {
            metrics.recordQuoteFetchFailure();
            throw new RateFetchException("No rates available for this shipment");
        }
        return normalized;
    }

    private List<Quote> normalize(List<Quote> quotes) {
        if (quotes == null) {
            return List.of();
        }
        Map<String, Quote> byId = new LinkedHashMap<>();
        quotes.stream()
                .filter(Objects::nonNull)
                .filter(q -> q.getQuoteId() != null && q.getAmount() != null && q.getAmount().signum() > 0)
                .sorted(Comparator.comparing(Quote::getAmount))
                .forEach(q -> byId.putIfAbsent(q.getQuoteId(), q));
        return List.copyOf(byId.values());
    }

    /**
     * Lookup counters since startup.
     */
    public record CacheStats(long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
