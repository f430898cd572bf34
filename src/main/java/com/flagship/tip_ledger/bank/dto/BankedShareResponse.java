package com.flagship.tip_ledger.bank.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.bank.BankedShare;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BankedShareResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("role")
    String role;

    @JsonProperty("from_employee_id")
    UUID fromEmployeeId;

    @JsonProperty("rule_id")
    UUID ruleId;

    @JsonProperty("tip_transaction_id")
    UUID tipTransactionId;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("status")
    String status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("collected_at")
    Instant collectedAt;

    @JsonProperty("ledger_entry_id")
    UUID ledgerEntryId;

    @JsonProperty("paid_out_at")
    Instant paidOutAt;

    @JsonProperty("payroll_ref")
    String payrollRef;

    public static BankedShareResponse from(BankedShare share) {
        return BankedShareResponse.builder()
            .id(share.getId())
            .employeeId(share.getEmployeeId())
            .role(share.getRole())
            .fromEmployeeId(share.getFromEmployeeId())
            .ruleId(share.getRuleId())
            .tipTransactionId(share.getTipTransactionId())
            .amountCents(share.getAmountCents())
            .status(share.getStatus().name())
            .createdAt(share.getCreatedAt())
            .collectedAt(share.getCollectedAt())
            .ledgerEntryId(share.getLedgerEntryId())
            .paidOutAt(share.getPaidOutAt())
            .payrollRef(share.getPayrollRef())
            .build();
    }
}
