package com.flagship.tip_ledger.tipout;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tip_out_rules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TipOutRuleEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "location_id", nullable = false, updatable = false)
    private UUID locationId;

    @Column(name = "from_role", nullable = false, length = 50)
    private String fromRole;

    @Column(name = "to_role", nullable = false, length = 50)
    private String toRole;

    @Column(name = "percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal percentage;

    @Column(name = "max_percentage", precision = 7, scale = 4)
    private BigDecimal maxPercentage;

    @Enumerated(EnumType.STRING)
    @Column(name = "basis_type", nullable = false, length = 20)
    private BasisType basisType;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "effective_from")
    private Instant effectiveFrom;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static TipOutRuleEntity fromDomain(TipOutRule rule) {
        return new TipOutRuleEntity(
            rule.getId(),
            rule.getLocationId(),
            rule.getFromRole(),
            rule.getToRole(),
            rule.getPercentage(),
            rule.getMaxPercentage(),
            rule.getBasisType(),
            rule.isActive(),
            rule.getEffectiveFrom(),
            rule.getExpiresAt(),
            rule.getCreatedAt(),
            rule.getUpdatedAt()
        );
    }

    public TipOutRule toDomain() {
        return new TipOutRule(id, locationId, fromRole, toRole, percentage, maxPercentage, basisType,
            active, effectiveFrom, expiresAt, createdAt, updatedAt);
    }

    public void revise(BigDecimal percentage, BigDecimal maxPercentage, BasisType basisType,
                       Instant effectiveFrom, Instant expiresAt) {
        TipOutRule.validate(percentage, maxPercentage, effectiveFrom, expiresAt);
        this.percentage = percentage;
        this.maxPercentage = maxPercentage;
        if (basisType != null) {
            this.basisType = basisType;
        }
        this.effectiveFrom = effectiveFrom;
        this.expiresAt = expiresAt;
        this.updatedAt = Instant.now();
    }

    public void setActive(boolean active) {
        this.active = active;
        this.updatedAt = Instant.now();
    }
}
