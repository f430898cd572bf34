package com.flagship.tip_ledger.consumer;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Runs each inbound event's handler at most once per consumer group.
 *
 * The handlers own their transactions and are idempotent on the payment id, so
 * the processed-event row is written after the handler commits. A crash in
 * between only causes a harmless replay. Failures that redelivery cannot fix
 * are recorded as REJECTED so the message can be acknowledged; everything else
 * is rethrown for redelivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private static final Set<ErrorKind> RETRYABLE = EnumSet.of(ErrorKind.BUSY, ErrorKind.INTEGRITY_VIOLATION);

    private final ProcessedEventRepository repository;

    /**
     * @return false if the event was already handled by this group
     */
    public boolean processEvent(UUID eventId, String eventType, String aggregateType, String aggregateKey,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (TipLedgerException e) {
            if (RETRYABLE.contains(e.getKind())) {
                throw e;
            }
            log.warn("Rejected event {} ({}) for {}: {} {}", eventId, eventType, aggregateKey, e.getKind(), e.getMessage());
            record(ProcessedEvent.rejected(eventId, eventType, aggregateType, aggregateKey, consumerGroup,
                e.getKind() + ": " + e.getMessage()));
            return true;
        }

        record(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateKey, consumerGroup));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    public void skipEvent(UUID eventId, String eventType, String aggregateType, String aggregateKey,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateKey, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        try {
            repository.saveAndFlush(ProcessedEventEntity.fromDomain(event));
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} was recorded concurrently by another consumer", event.getEventId());
        }
    }
}
