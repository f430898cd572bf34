package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.shift.Roles;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * "Every {@code fromRole} gives {@code percentage}% of {@code basisType} to
 * {@code toRole}", optionally capped at {@code maxPercentage}% of the giver's tips.
 */
@Value
public class TipOutRule {
    UUID id;
    UUID locationId;
    String fromRole;
    String toRole;
    BigDecimal percentage;
    BigDecimal maxPercentage;
    BasisType basisType;
    boolean active;
    Instant effectiveFrom;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    public static TipOutRule define(UUID locationId, String fromRole, String toRole, BigDecimal percentage,
                                    BigDecimal maxPercentage, BasisType basisType,
                                    Instant effectiveFrom, Instant expiresAt) {
        if (locationId == null) {
            throw new IllegalArgumentException("Location is required");
        }
        validate(percentage, maxPercentage, effectiveFrom, expiresAt);
        String from = Roles.normalize(fromRole);
        String to = Roles.normalize(toRole);
        if (from.equals(to)) {
            throw new IllegalArgumentException("A role cannot tip out to itself: " + from);
        }
        Instant now = Instant.now();
        return new TipOutRule(UUID.randomUUID(), locationId, from, to, percentage, maxPercentage,
            basisType != null ? basisType : BasisType.TIPS_EARNED, true, effectiveFrom, expiresAt, now, now);
    }

    static void validate(BigDecimal percentage, BigDecimal maxPercentage, Instant effectiveFrom, Instant expiresAt) {
        if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(TipOutCalculator.HUNDRED) > 0) {
            throw new IllegalArgumentException("Percentage must be in (0, 100], got " + percentage);
        }
        if (maxPercentage != null
                && (maxPercentage.signum() <= 0 || maxPercentage.compareTo(TipOutCalculator.HUNDRED) > 0)) {
            throw new IllegalArgumentException("Max percentage must be in (0, 100], got " + maxPercentage);
        }
        if (effectiveFrom != null && expiresAt != null && !effectiveFrom.isBefore(expiresAt)) {
            throw new IllegalArgumentException("Rule window is empty: " + effectiveFrom + " to " + expiresAt);
        }
    }

    /**
     * Active and inside {@code [effectiveFrom, expiresAt)} at {@code at}.
     */
    public boolean appliesAt(Instant at) {
        return active
            && (effectiveFrom == null || !at.isBefore(effectiveFrom))
            && (expiresAt == null || at.isBefore(expiresAt));
    }
}
