package com.flagship.tip_ledger.event;

import com.flagship.tip_ledger.debt.TipDebt;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TipDebtWrittenOffEvent implements TipEvent {
    UUID eventId;
    UUID debtId;
    UUID employeeId;
    long forgivenCents;
    String reason;
    String writtenOffBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TipDebtWrittenOff";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TipDebtWrittenOffEvent from(TipDebt debt, long forgivenCents) {
        return new TipDebtWrittenOffEvent(
            UUID.randomUUID(),
            debt.getId(),
            debt.getEmployeeId(),
            forgivenCents,
            debt.getWriteOffReason(),
            debt.getWrittenOffBy(),
            Instant.now()
        );
    }
}
