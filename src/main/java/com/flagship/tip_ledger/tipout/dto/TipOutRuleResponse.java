package com.flagship.tip_ledger.tipout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.tipout.TipOutRule;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TipOutRuleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("from_role")
    String fromRole;

    @JsonProperty("to_role")
    String toRole;

    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("max_percentage")
    BigDecimal maxPercentage;

    @JsonProperty("basis_type")
    String basisType;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("effective_from")
    Instant effectiveFrom;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static TipOutRuleResponse from(TipOutRule rule) {
        return TipOutRuleResponse.builder()
            .id(rule.getId())
            .locationId(rule.getLocationId())
            .fromRole(rule.getFromRole())
            .toRole(rule.getToRole())
            .percentage(rule.getPercentage())
            .maxPercentage(rule.getMaxPercentage())
            .basisType(rule.getBasisType().name())
            .active(rule.isActive())
            .effectiveFrom(rule.getEffectiveFrom())
            .expiresAt(rule.getExpiresAt())
            .build();
    }
}
