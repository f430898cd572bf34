package com.flagship.tip_ledger.consumer;

import com.flagship.tip_ledger.attribution.Tender;
import com.flagship.tip_ledger.attribution.TipCollection;
import com.flagship.tip_ledger.attribution.TipKind;
import com.flagship.tip_ledger.attribution.TipTarget;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A finalized payment with a tip component, as published by the payment subsystem.
 * Exactly one of {@code employeeId}, {@code poolId} and {@code owners} names the target.
 */
@Value
@Builder
@Jacksonized
public class PaymentCompletedMessage {
    public static final String EVENT_TYPE = "PaymentCompleted";

    UUID eventId;
    String eventType;
    String paymentId;
    UUID locationId;
    long tipAmountCents;
    Instant collectedAt;
    UUID employeeId;
    UUID poolId;
    List<TipTarget.Owner> owners;
    TipKind kind;
    Tender tender;
    String section;
    Long salesAmountCents;

    public TipCollection toCollection() {
        boolean owned = owners != null && !owners.isEmpty();
        int targets = (employeeId != null ? 1 : 0) + (poolId != null ? 1 : 0) + (owned ? 1 : 0);
        if (targets != 1) {
            throw TipLedgerException.validation("Payment %s must target exactly one employee, pool or owner split",
                paymentId);
        }
        TipTarget target;
        if (owned) {
            target = TipTarget.ownership(owners);
        } else {
            target = employeeId != null ? TipTarget.employee(employeeId) : TipTarget.pool(poolId);
        }
        return TipCollection.builder()
            .paymentId(paymentId)
            .locationId(locationId)
            .amountCents(tipAmountCents)
            .collectedAt(collectedAt)
            .target(target)
            .kind(kind)
            .tender(tender)
            .section(section)
            .salesAmountCents(salesAmountCents)
            .build();
    }
}
