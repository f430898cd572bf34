package com.flagship.tip_ledger.bank.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PayOutRequest {

    @NotBlank(message = "Payroll reference is required")
    @JsonProperty("payroll_ref")
    String payrollRef;
}
