package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreatePoolRequest {

    @NotNull(message = "Location ID is required")
    @JsonProperty("location_id")
    UUID locationId;

    @NotBlank(message = "Pool name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Owner is required")
    @JsonProperty("owner_employee_id")
    UUID ownerEmployeeId;

    @NotBlank(message = "Split mode is required")
    @JsonProperty("split_mode")
    String splitMode;

    @JsonProperty("created_at")
    Instant createdAt;

    @Valid
    @JsonProperty("members")
    List<MemberRequest> members;
}
