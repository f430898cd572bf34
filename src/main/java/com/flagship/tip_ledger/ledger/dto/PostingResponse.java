package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.ledger.PostingResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PostingResponse {

    @JsonProperty("entry")
    LedgerEntryResponse entry;

    @JsonProperty("recoveries")
    List<LedgerEntryResponse> recoveries;

    @JsonProperty("net_amount_cents")
    long netAmountCents;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static PostingResponse from(PostingResult result) {
        return PostingResponse.builder()
            .entry(LedgerEntryResponse.from(result.getEntry()))
            .recoveries(result.getRecoveries().stream().map(LedgerEntryResponse::from).toList())
            .netAmountCents(result.netAmountCents())
            .duplicate(result.isDuplicate())
            .build();
    }
}
