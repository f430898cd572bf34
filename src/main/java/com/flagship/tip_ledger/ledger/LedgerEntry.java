package com.flagship.tip_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable, append-only balance change.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID accountId;
    long amountCents;
    EntrySourceType sourceType;
    UUID sourceId;
    String idempotencyKey;
    UUID reversesEntryId;      // set only on REVERSAL entries
    String memo;
    Instant createdAt;
    Long sequenceNumber;       // assigned by database

    public boolean isCredit() {
        return amountCents > 0;
    }

    public boolean isReversal() {
        return sourceType == EntrySourceType.REVERSAL;
    }
}
