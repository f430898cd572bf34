package com.flagship.tip_ledger.tipout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.tipout.BasisType;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Body for creating a rule. On update only the terms are read; location and
 * roles are fixed once a rule exists.
 */
@Value
@Builder
@Jacksonized
public class TipOutRuleRequest {

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("from_role")
    String fromRole;

    @JsonProperty("to_role")
    String toRole;

    @NotNull(message = "Percentage is required")
    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("max_percentage")
    BigDecimal maxPercentage;

    @JsonProperty("basis_type")
    BasisType basisType;

    @JsonProperty("effective_from")
    Instant effectiveFrom;

    @JsonProperty("expires_at")
    Instant expiresAt;
}
