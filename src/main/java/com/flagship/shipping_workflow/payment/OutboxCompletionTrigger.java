package com.flagship.shipping_workflow.payment;

import com.flagship.shipping_workflow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.UUID;

/**
 * Completion trigger backed by the transactional outbox: the request is
 * published to Kafka only if the payment's transaction commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxCompletionTrigger implements CompletionTrigger {

    static final String ORDER_AGGREGATE = "Order";
    static final String TOP_UP_AGGREGATE = "BalanceTopUp";

    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public void fire(CompletionRequest request) {
        String aggregateType = request.getOrderId() != null ? ORDER_AGGREGATE : TOP_UP_AGGREGATE;
        UUID aggregateId = request.getOrderId() != null
                ? request.getOrderId()
                : UUID.nameUUIDFromBytes(request.getExternalReference().getBytes(StandardCharsets.UTF_8));

        outboxService.saveEvent(aggregateType, aggregateId, ShipmentCompletionRequestedEvent.EVENT_TYPE,
                ShipmentCompletionRequestedEvent.from(request, clock.instant()));

        log.info("Completion requested: kind={}, userKey={}, externalReference={}",
                request.getKind(), request.getUserKey(), request.getExternalReference());
    }
}
