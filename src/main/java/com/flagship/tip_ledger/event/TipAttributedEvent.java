package com.flagship.tip_ledger.event;

import com.flagship.tip_ledger.attribution.EmployeeShare;
import com.flagship.tip_ledger.attribution.TipTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per tip transaction, after its shares were posted.
 */
@Value
public class TipAttributedEvent implements TipEvent {
    UUID eventId;
    UUID tipTransactionId;
    String paymentId;
    UUID locationId;
    long amountCents;
    Instant collectedAt;
    UUID poolId;
    UUID segmentId;
    List<EmployeeShare> shares;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TipAttributed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TipAttributedEvent from(TipTransaction transaction, List<EmployeeShare> shares) {
        return new TipAttributedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getPaymentId(),
            transaction.getLocationId(),
            transaction.getAmountCents(),
            transaction.getCollectedAt(),
            transaction.getPoolId(),
            transaction.getSegmentId(),
            List.copyOf(shares),
            Instant.now()
        );
    }
}
