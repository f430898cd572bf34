package com.flagship.tip_ledger.attribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.attribution.TipTarget;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class OwnerShareRequest {

    @NotNull(message = "Owner employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @NotNull(message = "Owner percentage is required")
    @Positive(message = "Owner percentage must be positive")
    @JsonProperty("percent")
    BigDecimal percent;

    public TipTarget.Owner toOwner() {
        return new TipTarget.Owner(employeeId, percent);
    }
}
