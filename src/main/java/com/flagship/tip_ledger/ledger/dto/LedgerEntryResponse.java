package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("source_type")
    String sourceType;

    @JsonProperty("source_id")
    UUID sourceId;

    @JsonProperty("reverses_entry_id")
    UUID reversesEntryId;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .accountId(entry.getAccountId())
            .amountCents(entry.getAmountCents())
            .sourceType(entry.getSourceType().name())
            .sourceId(entry.getSourceId())
            .reversesEntryId(entry.getReversesEntryId())
            .memo(entry.getMemo())
            .sequenceNumber(entry.getSequenceNumber())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
