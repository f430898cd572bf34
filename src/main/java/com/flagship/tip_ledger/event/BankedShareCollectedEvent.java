package com.flagship.tip_ledger.event;

import com.flagship.tip_ledger.bank.BankedShare;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BankedShareCollectedEvent implements TipEvent {
    UUID eventId;
    UUID bankedShareId;
    UUID employeeId;
    long amountCents;
    UUID ledgerEntryId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BankedShareCollected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BankedShareCollectedEvent from(BankedShare share) {
        return new BankedShareCollectedEvent(
            UUID.randomUUID(),
            share.getId(),
            share.getEmployeeId(),
            share.getAmountCents(),
            share.getLedgerEntryId(),
            Instant.now()
        );
    }
}
