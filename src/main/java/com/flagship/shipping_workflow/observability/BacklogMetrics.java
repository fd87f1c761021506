package com.flagship.shipping_workflow.observability;

import com.flagship.shipping_workflow.outbox.OutboxEventRepository;
import com.flagship.shipping_workflow.payment.PaymentRecordRepository;
import com.flagship.shipping_workflow.payment.PaymentStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work waiting on something outside the process: completion requests not yet
 * on Kafka and invoices not yet paid.
 *
 * Gauges serve the last values read by {@link MetricsScheduler}, so scrapes
 * and health checks never hit the database.
 */
@Component
@Slf4j
public class BacklogMetrics {

    private final OutboxEventRepository outboxRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong unpublished = new AtomicLong();
    private final AtomicLong oldestUnpublishedAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();
    private final AtomicLong pendingPayments = new AtomicLong();

    public BacklogMetrics(OutboxEventRepository outboxRepository,
                          PaymentRecordRepository paymentRecordRepository,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.paymentRecordRepository = paymentRecordRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;

        Gauge.builder("outbox.backlog.size", unpublished, AtomicLong::get)
                .description("Completion requests not yet acknowledged by Kafka")
                .register(meterRegistry);
        Gauge.builder("outbox.backlog.age.seconds", oldestUnpublishedAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished completion request")
                .register(meterRegistry);
        Gauge.builder("outbox.events.dead", deadLetters, AtomicLong::get)
                .description("Completion requests that exhausted their retries")
                .register(meterRegistry);
        Gauge.builder("payments.pending", pendingPayments, AtomicLong::get)
                .description("Invoices and top-ups waiting for the provider")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            unpublished.set(outboxRepository.countByPublishedAtIsNull());
            oldestUnpublishedAgeSeconds.set(outboxRepository.findOldestPendingCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));
            deadLetters.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
            pendingPayments.set(paymentRecordRepository.countByStatus(PaymentStatus.PENDING));
        } catch (RuntimeException e) {
            // keep serving the previous values
            log.warn("Backlog refresh failed: {}", e.getMessage());
        }
    }

    public long unpublishedCount() {
        return unpublished.get();
    }

    public long deadLetterCount() {
        return deadLetters.get();
    }

    public long oldestUnpublishedAgeSeconds() {
        return oldestUnpublishedAgeSeconds.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
