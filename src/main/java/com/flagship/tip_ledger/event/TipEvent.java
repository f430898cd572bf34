package com.flagship.tip_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published by the tip engine through the outbox.
 */
public interface TipEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    Instant getOccurredAt();

    /**
     * Routing name, also used as the outbox event type.
     */
    String getEventType();
}
