package com.flagship.tip_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.debt.TipDebt;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TipDebtResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("tip_transaction_id")
    UUID tipTransactionId;

    @JsonProperty("original_amount_cents")
    long originalAmountCents;

    @JsonProperty("remaining_cents")
    long remainingCents;

    @JsonProperty("status")
    String status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("recovered_at")
    Instant recoveredAt;

    @JsonProperty("written_off_at")
    Instant writtenOffAt;

    @JsonProperty("written_off_by")
    String writtenOffBy;

    @JsonProperty("write_off_reason")
    String writeOffReason;

    public static TipDebtResponse from(TipDebt debt) {
        return TipDebtResponse.builder()
            .id(debt.getId())
            .employeeId(debt.getEmployeeId())
            .tipTransactionId(debt.getTipTransactionId())
            .originalAmountCents(debt.getOriginalAmountCents())
            .remainingCents(debt.getRemainingCents())
            .status(debt.getStatus().name())
            .createdAt(debt.getCreatedAt())
            .recoveredAt(debt.getRecoveredAt())
            .writtenOffAt(debt.getWrittenOffAt())
            .writtenOffBy(debt.getWrittenOffBy())
            .writeOffReason(debt.getWriteOffReason())
            .build();
    }
}
