package com.flagship.tip_ledger.attribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.attribution.Tender;
import com.flagship.tip_ledger.attribution.TipCollection;
import com.flagship.tip_ledger.attribution.TipKind;
import com.flagship.tip_ledger.attribution.TipTarget;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A finalized payment's tip. Exactly one of {@code employee_id}, {@code pool_id}
 * and {@code owners} must be present.
 */
@Value
@Builder
@Jacksonized
public class RecordTipRequest {

    @NotBlank(message = "Payment ID is required")
    @JsonProperty("payment_id")
    String paymentId;

    @NotNull(message = "Location ID is required")
    @JsonProperty("location_id")
    UUID locationId;

    @NotNull(message = "Tip amount is required")
    @Positive(message = "Tip amount must be positive")
    @JsonProperty("amount_cents")
    Long amountCents;

    @NotNull(message = "Collection time is required")
    @JsonProperty("collected_at")
    Instant collectedAt;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("pool_id")
    UUID poolId;

    @Valid
    @JsonProperty("owners")
    List<OwnerShareRequest> owners;

    @JsonProperty("kind")
    TipKind kind;

    @JsonProperty("tender")
    Tender tender;

    @JsonProperty("section")
    String section;

    @PositiveOrZero(message = "Sales amount cannot be negative")
    @JsonProperty("sales_amount_cents")
    Long salesAmountCents;

    public TipCollection toCollection() {
        boolean owned = owners != null && !owners.isEmpty();
        int targets = (employeeId != null ? 1 : 0) + (poolId != null ? 1 : 0) + (owned ? 1 : 0);
        if (targets != 1) {
            throw TipLedgerException.validation("Exactly one of employee_id, pool_id and owners is required");
        }
        TipTarget target;
        if (owned) {
            target = TipTarget.ownership(owners.stream().map(OwnerShareRequest::toOwner).toList());
        } else {
            target = employeeId != null ? TipTarget.employee(employeeId) : TipTarget.pool(poolId);
        }
        return TipCollection.builder()
            .paymentId(paymentId)
            .locationId(locationId)
            .amountCents(amountCents)
            .collectedAt(collectedAt)
            .target(target)
            .kind(kind)
            .tender(tender)
            .section(section)
            .salesAmountCents(salesAmountCents)
            .build();
    }
}
