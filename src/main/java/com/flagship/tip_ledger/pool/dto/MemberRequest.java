package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A member to add. {@code weight} only matters for weighted pools; {@code at}
 * is ignored on pool creation and defaults to now on join.
 */
@Value
@Builder
@Jacksonized
public class MemberRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("weight")
    BigDecimal weight;

    @JsonProperty("at")
    Instant at;
}
