package com.flagship.tip_ledger.attribution;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * One collected tip. Its credits all carry this id as {@code sourceId} and sum
 * to {@code amountCents}.
 *
 * {@code grossAmountCents} is what the guest left; {@code amountCents} is what
 * was attributed after the card fee.
 */
@Value
@Builder
public class TipTransaction {
    UUID id;
    String paymentId;
    UUID locationId;
    TipKind kind;
    Tender tender;
    long grossAmountCents;
    long cardFeeCents;
    long amountCents;
    Long salesAmountCents;
    String section;
    Instant collectedAt;
    String targetType;
    UUID employeeId;           // set for direct tips
    UUID poolId;               // set for pooled tips
    UUID segmentId;
    @With
    TipTransactionStatus status;
    Instant createdAt;
    @With
    Instant chargedBackAt;

    public boolean isPooled() {
        return poolId != null;
    }

    public boolean isChargedBack() {
        return status == TipTransactionStatus.CHARGED_BACK;
    }
}
