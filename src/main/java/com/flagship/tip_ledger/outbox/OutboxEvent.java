package com.flagship.tip_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A tip event waiting in the outbox table to be relayed to Kafka.
 *
 * Written in the same transaction as the ledger postings it describes, so an
 * event exists if and only if its postings committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // TipTransaction, TipDebt, BankedShare
    UUID aggregateId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
