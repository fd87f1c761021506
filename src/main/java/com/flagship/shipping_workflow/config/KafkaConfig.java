package com.flagship.shipping_workflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Provider payment events in, shipment completion requests out. Payment
 * events are keyed by external reference and completions by order id, so
 * each key keeps its order within a partition.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${kafka.topic.payment-events:payment-events}")
    private String paymentEventsTopic;

    @Value("${kafka.topic.shipment-completions:shipment-completions}")
    private String shipmentCompletionsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic paymentEventsTopic() {
        return TopicBuilder.name(paymentEventsTopic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public NewTopic shipmentCompletionsTopic() {
        return TopicBuilder.name(shipmentCompletionsTopic).partitions(partitions).replicas(1).build();
    }

    /**
     * Redelivers a failing payment event a few times, then logs it and moves
     * on. A later webhook delivery for the same reference is still applied.
     */
    @Bean
    public DefaultErrorHandler paymentEventErrorHandler(
            @Value("${consumer.retry.interval-ms:1000}") long intervalMs,
            @Value("${consumer.retry.attempts:5}") long attempts) {
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, e) -> log.error("Giving up on payment event at {}-{}@{}: {}",
                        record.topic(), record.partition(), record.offset(), e.getMessage()),
                new FixedBackOff(intervalMs, attempts));
        handler.addNotRetryableExceptions(JsonProcessingException.class, IllegalArgumentException.class);
        return handler;
    }
}
