package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.shipping_workflow.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for provider payment-status events.
 *
 * Offsets are committed manually after the coordinator returns, so a crash
 * mid-processing redelivers the event; the coordinator makes the redelivery
 * harmless. Unparseable messages are acknowledged and skipped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentEventConsumer {

    private final PaymentCompletionCoordinator coordinator;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payment-events:payment-events}",
        groupId = "${spring.kafka.consumer.group-id:shipping-workflow-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        try (MDC.MDCCloseable ignored = CorrelationContext.correlation(CorrelationContext.newCorrelationId())) {
            log.debug("Received payment event: partition={}, offset={}, key={}",
                    record.partition(), record.offset(), record.key());

            PaymentEvent event;
            try {
                event = objectMapper.readValue(record.value(), PaymentEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Could not parse payment event at offset {}, skipping: {}",
                        record.offset(), e.getOriginalMessage());
                ack.acknowledge();
                return;
            }

            PaymentOutcome outcome = coordinator.apply(event);
            ack.acknowledge();

            log.info("Payment event consumed: externalReference={}, status={}, outcome={}",
                    event.getExternalReference(), event.getStatus(), outcome);
        } catch (RuntimeException e) {
            // not acknowledged, the container redelivers
            log.error("Error processing payment event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }
}
