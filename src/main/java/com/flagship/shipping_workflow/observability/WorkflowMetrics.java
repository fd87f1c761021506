package com.flagship.shipping_workflow.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Centralized metrics for the workflow engine.
 *
 * Metrics exposed:
 * - workflow.transitions: step changes, tagged by source, target and kind (forward, skip, rollback)
 * - workflow.input.rejected: validation failures per step
 * - workflow.sessions.expired: mutations that found no live session
 * - workflow.lock.timeouts: per-user lock acquisitions that gave up
 * - workflow.sessions.finalized: hand-offs, tagged by finalization mode
 * - quotes.cache: cache lookups, tagged hit/miss
 * - payments.events: coordinator outcomes
 * - workflow.operation.latency: timer per controller operation
 */
@Component
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Workflow ====================

    public void recordTransition(String from, String to, String kind) {
        registry.counter("workflow.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to),
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordInputRejected(String step) {
        registry.counter("workflow.input.rejected", "step", sanitizeTag(step)).increment();
    }

    public void recordSessionExpired() {
        registry.counter("workflow.sessions.expired").increment();
    }

    public void recordSessionsPurged(int count) {
        registry.counter("workflow.sessions.purged").increment(count);
    }

    public void recordLockTimeout() {
        registry.counter("workflow.lock.timeouts").increment();
    }

    /**
     * Records a session hand-off. {@code mode} is "transactional" or "sequential".
     */
    public void recordFinalization(String mode) {
        registry.counter("workflow.sessions.finalized", "mode", sanitizeTag(mode)).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("workflow.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Quotes ====================

    public void recordQuoteCacheHit() {
        registry.counter("quotes.cache", "result", "hit").increment();
    }

    public void recordQuoteCacheMiss() {
        registry.counter("quotes.cache", "result", "miss").increment();
    }

    public void recordQuoteFetchFailure() {
        registry.counter("quotes.fetch.failure").increment();
    }

    // ==================== Payments ====================

    public void recordPaymentOutcome(String kind, String outcome) {
        registry.counter("payments.events",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPendingPaymentsExpired(int count) {
        registry.counter("payments.pending.expired").increment(count);
    }

    // ==================== Gauges ====================

    /**
     * Registers a gauge for the number of per-user locks held in memory.
     */
    public void registerLockRegistryGauge(Map<?, ?> locks) {
        registry.gaugeMapSize("workflow.lock.registry.size", Tags.empty(), locks);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
