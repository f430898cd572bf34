package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Signed manager correction; negative amounts debit the employee.
 */
@Value
@Builder
@Jacksonized
public class AdjustmentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_cents")
    Long amountCents;

    @NotBlank(message = "Memo is required")
    @JsonProperty("memo")
    String memo;
}
