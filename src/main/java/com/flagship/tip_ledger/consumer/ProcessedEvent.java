package com.flagship.tip_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an inbound event.
 * {@code aggregateKey} is the payment id the event is about.
 */
@Value
public class ProcessedEvent {
    UUID id;
    UUID eventId;
    String eventType;
    String aggregateType;
    String aggregateKey;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,    // not relevant to this consumer
        REJECTED    // permanently invalid; redelivery would fail the same way
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         String aggregateKey, String consumerGroup) {
        return record(eventId, eventType, aggregateType, aggregateKey, consumerGroup, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         String aggregateKey, String consumerGroup, String reason) {
        return record(eventId, eventType, aggregateType, aggregateKey, consumerGroup, ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent rejected(UUID eventId, String eventType, String aggregateType,
                                          String aggregateKey, String consumerGroup, String errorMessage) {
        return record(eventId, eventType, aggregateType, aggregateKey, consumerGroup,
            ProcessingResult.REJECTED, errorMessage);
    }

    private static ProcessedEvent record(UUID eventId, String eventType, String aggregateType, String aggregateKey,
                                         String consumerGroup, ProcessingResult result, String message) {
        return new ProcessedEvent(UUID.randomUUID(), eventId, eventType, aggregateType, aggregateKey,
            consumerGroup, Instant.now(), result, message);
    }
}
