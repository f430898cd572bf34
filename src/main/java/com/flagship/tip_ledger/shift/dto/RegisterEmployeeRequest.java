package com.flagship.tip_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class RegisterEmployeeRequest {

    @NotNull(message = "Location ID is required")
    @JsonProperty("location_id")
    UUID locationId;

    @NotBlank(message = "Display name is required")
    @JsonProperty("display_name")
    String displayName;

    @NotBlank(message = "Role is required")
    @JsonProperty("role")
    String role;

    @JsonProperty("section")
    String section;
}
