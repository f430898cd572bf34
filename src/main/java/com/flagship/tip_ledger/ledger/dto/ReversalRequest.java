package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ReversalRequest {

    @JsonProperty("memo")
    String memo;
}
