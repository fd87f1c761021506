package com.flagship.shipping_workflow.quote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local quote cache with lazy expiry on read and a periodic cleanup.
 */
@Component
@ConditionalOnProperty(name = "workflow.quotes.cache", havingValue = "memory")
@Slf4j
public class InMemoryQuoteCache implements QuoteCache {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryQuoteCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<List<Quote>> get(String fingerprint) {
        Entry entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(fingerprint, entry);
            return Optional.empty();
        }
        return Optional.of(entry.quotes());
    }

    @Override
    public void set(String fingerprint, List<Quote> quotes, Duration ttl) {
        entries.put(fingerprint, new Entry(List.copyOf(quotes), clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String fingerprint) {
        entries.remove(fingerprint);
    }

    @Scheduled(fixedRateString = "${workflow.quotes.cleanup-interval-ms:300000}")
    public void scheduledCleanup() {
        int removed = cleanupExpired();
        if (removed > 0) {
            log.debug("Removed expired quote entries: count={}", removed);
        }
    }

    /**
     * Drops expired entries that were never read again.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (var it = entries.entrySet().iterator(); it.hasNext(); ) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private record Entry(List<Quote> quotes, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
