package com.flagship.shipping_workflow.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Outbox writes and publisher bookkeeping.
 *
 * {@link #saveEvent} joins the caller's transaction, so a completion request
 * exists exactly when the payment or order change that caused it committed.
 * Bookkeeping calls from {@link OutboxPublisher} each run in their own
 * transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType,
                toJson(payload), clock.instant());
        repository.save(OutboxEventEntity.of(event));

        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return event;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.lockNextBatch(limit, maxRetries).stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.published(clock.instant()));
    }

    /**
     * Counts a failed send and returns the attempts made so far, or 0 when
     * the event no longer exists.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String error) {
        return repository.findById(eventId)
                .map(entity -> {
                    entity.failedAttempt(error);
                    return entity.getRetryCount();
                })
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countByPublishedAtIsNull();
    }

    private String toJson(Object payload) {
        if (payload instanceof String) {
            return (String) payload;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Completion payload is not serializable", e);
        }
    }
}
