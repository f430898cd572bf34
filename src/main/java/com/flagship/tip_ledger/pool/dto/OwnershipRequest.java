package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class OwnershipRequest {

    @NotNull(message = "New owner is required")
    @JsonProperty("owner_employee_id")
    UUID ownerEmployeeId;
}
