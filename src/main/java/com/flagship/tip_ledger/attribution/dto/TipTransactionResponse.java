package com.flagship.tip_ledger.attribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.attribution.TipTransaction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TipTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_id")
    String paymentId;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("kind")
    String kind;

    @JsonProperty("tender")
    String tender;

    @JsonProperty("gross_amount_cents")
    long grossAmountCents;

    @JsonProperty("card_fee_cents")
    long cardFeeCents;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("target_type")
    String targetType;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("pool_id")
    UUID poolId;

    @JsonProperty("segment_id")
    UUID segmentId;

    @JsonProperty("status")
    String status;

    @JsonProperty("collected_at")
    Instant collectedAt;

    @JsonProperty("charged_back_at")
    Instant chargedBackAt;

    public static TipTransactionResponse from(TipTransaction transaction) {
        return TipTransactionResponse.builder()
            .id(transaction.getId())
            .paymentId(transaction.getPaymentId())
            .locationId(transaction.getLocationId())
            .kind(transaction.getKind().name())
            .tender(transaction.getTender().name())
            .grossAmountCents(transaction.getGrossAmountCents())
            .cardFeeCents(transaction.getCardFeeCents())
            .amountCents(transaction.getAmountCents())
            .targetType(transaction.getTargetType())
            .employeeId(transaction.getEmployeeId())
            .poolId(transaction.getPoolId())
            .segmentId(transaction.getSegmentId())
            .status(transaction.getStatus().name())
            .collectedAt(transaction.getCollectedAt())
            .chargedBackAt(transaction.getChargedBackAt())
            .build();
    }
}
