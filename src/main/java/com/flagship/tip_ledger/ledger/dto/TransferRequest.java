package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class TransferRequest {

    @NotNull(message = "Source employee is required")
    @JsonProperty("from_employee_id")
    UUID fromEmployeeId;

    @NotNull(message = "Destination employee is required")
    @JsonProperty("to_employee_id")
    UUID toEmployeeId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @JsonProperty("amount_cents")
    Long amountCents;

    @JsonProperty("memo")
    String memo;
}
