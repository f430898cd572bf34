package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One finalized payment's tip component, as handed over by the payment subsystem.
 *
 * {@code paymentId} seeds every idempotency key derived from this collection.
 */
@Value
public class TipCollection {
    String paymentId;
    UUID locationId;
    long amountCents;
    Instant collectedAt;
    TipTarget target;
    TipKind kind;
    Tender tender;
    String section;
    Long salesAmountCents;

    @Builder
    private TipCollection(String paymentId, UUID locationId, long amountCents, Instant collectedAt,
                          TipTarget target, TipKind kind, Tender tender, String section, Long salesAmountCents) {
        if (paymentId == null || paymentId.isBlank()) {
            throw TipLedgerException.validation("Payment id is required");
        }
        if (locationId == null) {
            throw TipLedgerException.validation("Location id is required");
        }
        if (amountCents <= 0) {
            throw TipLedgerException.validation("Tip amount must be positive, got %d", amountCents);
        }
        if (collectedAt == null) {
            throw TipLedgerException.validation("Collection time is required");
        }
        if (target == null) {
            throw TipLedgerException.validation("Tip target is required");
        }
        if (salesAmountCents != null && salesAmountCents < 0) {
            throw TipLedgerException.validation("Sales amount cannot be negative, got %d", salesAmountCents);
        }
        this.paymentId = paymentId.trim();
        this.locationId = locationId;
        this.amountCents = amountCents;
        this.collectedAt = collectedAt;
        this.target = target;
        this.kind = kind != null ? kind : TipKind.TIP;
        this.tender = tender != null ? tender : Tender.CARD;
        this.section = section;
        this.salesAmountCents = salesAmountCents;
    }
}
