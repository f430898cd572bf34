package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.ledger.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("debit")
    LedgerEntryResponse debit;

    @JsonProperty("credit")
    LedgerEntryResponse credit;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .transferId(result.getTransferId())
            .debit(LedgerEntryResponse.from(result.getDebit()))
            .credit(LedgerEntryResponse.from(result.getCredit()))
            .duplicate(result.isDuplicate())
            .build();
    }
}
