package com.flagship.tip_ledger.ledger;

import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A single entry to append to one account.
 *
 * The builder validates, so an invalid request never reaches the database.
 */
@Value
public class PostingRequest {
    UUID accountId;
    long amountCents;
    EntrySourceType sourceType;
    UUID sourceId;
    String idempotencyKey;
    String memo;
    UUID reversesEntryId;

    @Builder
    private PostingRequest(UUID accountId, long amountCents, EntrySourceType sourceType,
                           UUID sourceId, String idempotencyKey, String memo, UUID reversesEntryId) {
        if (accountId == null) {
            throw TipLedgerException.validation("Account id is required");
        }
        if (amountCents == 0) {
            throw TipLedgerException.validation("Amount must be non-zero");
        }
        if (sourceType == null || sourceId == null) {
            throw TipLedgerException.validation("Source type and source id are required");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw TipLedgerException.validation("Idempotency key cannot be null or blank");
        }
        if (sourceType == EntrySourceType.REVERSAL && reversesEntryId == null) {
            throw TipLedgerException.validation("A reversal must reference the entry it reverses");
        }
        this.accountId = accountId;
        this.amountCents = amountCents;
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.idempotencyKey = idempotencyKey;
        this.memo = memo;
        this.reversesEntryId = reversesEntryId;
    }
}
