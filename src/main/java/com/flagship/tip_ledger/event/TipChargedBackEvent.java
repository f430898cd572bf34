package com.flagship.tip_ledger.event;

import com.flagship.tip_ledger.attribution.TipTransaction;
import com.flagship.tip_ledger.debt.ChargebackPolicy;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TipChargedBackEvent implements TipEvent {
    UUID eventId;
    UUID tipTransactionId;
    String paymentId;
    long amountCents;
    ChargebackPolicy policy;
    long reversedCents;
    long debtOpenedCents;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TipChargedBack";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TipChargedBackEvent from(TipTransaction transaction, ChargebackPolicy policy,
                                           long reversedCents, long debtOpenedCents) {
        return new TipChargedBackEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getPaymentId(),
            transaction.getAmountCents(),
            policy,
            reversedCents,
            debtOpenedCents,
            Instant.now()
        );
    }
}
