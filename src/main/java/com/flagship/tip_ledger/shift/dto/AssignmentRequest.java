package com.flagship.tip_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * New role and home section for an employee.
 */
@Value
@Builder
@Jacksonized
public class AssignmentRequest {

    @NotBlank(message = "Role is required")
    @JsonProperty("role")
    String role;

    @JsonProperty("section")
    String section;
}
