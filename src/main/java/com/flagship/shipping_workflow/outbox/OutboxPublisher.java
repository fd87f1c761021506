package com.flagship.shipping_workflow.outbox;

import com.flagship.shipping_workflow.observability.BacklogMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ships queued completion requests to the fulfilment topic.
 *
 * A request is marked published only after the broker acknowledged it, so
 * delivery is at least once and consumers dedupe on {@code external_reference}.
 * After {@code outbox.publisher.max-retries} failed sends a request stays in
 * the table as a dead letter and is no longer polled.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event_type";
    static final String AGGREGATE_TYPE_HEADER = "aggregate_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final BacklogMetrics backlogMetrics;

    @Value("${kafka.topic.shipment-completions:shipment-completions}")
    private String completionsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not poll the outbox, retrying on the next tick", e);
            return;
        }

        for (OutboxEvent event : batch) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            send(event);
        }
    }

    private void send(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(completionsTopic, event.partitionKey(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));

        try {
            kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            backlogMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} for {} {}", event.getEventType(), event.getAggregateType(), event.getAggregateId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(event, "interrupted while waiting for the broker");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failed(event, cause.getMessage());
        } catch (TimeoutException e) {
            failed(event, "no broker acknowledgement within " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            failed(event, e.getMessage());
        }
    }

    private void failed(OutboxEvent event, String error) {
        int attempts = outboxService.markFailed(event.getId(), error);
        backlogMetrics.recordEventPublishFailed(event.getEventType());

        if (attempts >= maxRetries) {
            log.error("Completion request {} for {} {} dead-lettered after {} attempts: {}",
                    event.getId(), event.getAggregateType(), event.getAggregateId(), attempts, error);
            backlogMetrics.recordEventDeadLettered(event.getEventType());
        } else {
            log.warn("Completion request {} not published (attempt {}/{}): {}",
                    event.getId(), attempts, maxRetries, error);
        }
    }
}
