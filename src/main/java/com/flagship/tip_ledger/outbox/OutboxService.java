package com.flagship.tip_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tip_ledger.event.TipEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes tip events into the outbox inside the caller's transaction, and
 * relays them in batches for the publisher.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Must run inside the transaction that made the change the event describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, TipEvent event) {
        OutboxEvent pending = OutboxEvent.pending(aggregateType, aggregateId, event.getEventType(), serialize(event));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(pending));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
            event.getEventType(), aggregateType, aggregateId);
        return saved.toDomain();
    }

    /**
     * Locks up to {@code limit} publishable events, hands each to {@code sender}
     * and records the outcome, all before the row locks are released.
     *
     * @return number of events sent successfully
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RelayOutcome relayBatch(int limit, int maxRetries, OutboxSender sender) {
        List<OutboxEventEntity> batch = repository.findPublishableForUpdate(limit, maxRetries);
        int sent = 0;
        int failed = 0;
        for (OutboxEventEntity entity : batch) {
            try {
                sender.send(entity.toDomain());
                entity.markPublished();
                sent++;
            } catch (Exception e) {
                entity.markFailed(e.getMessage());
                failed++;
                log.error("Failed to publish outbox event: eventId={}, eventType={}, retry={}, error={}",
                    entity.getId(), entity.getEventType(), entity.getRetryCount(), e.getMessage());
                if (entity.getRetryCount() >= maxRetries) {
                    log.warn("Outbox event {} reached {} retries and is dead-lettered", entity.getId(), maxRetries);
                }
            }
        }
        return new RelayOutcome(sent, failed);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Delivers one event downstream; throwing marks the event for retry.
     */
    @FunctionalInterface
    public interface OutboxSender {
        void send(OutboxEvent event) throws Exception;
    }

    public record RelayOutcome(int sent, int failed) {
    }

    private String serialize(TipEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
