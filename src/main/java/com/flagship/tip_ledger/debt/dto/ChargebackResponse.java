package com.flagship.tip_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.debt.ChargebackResult;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ChargebackResponse {

    @JsonProperty("tip_transaction_id")
    UUID tipTransactionId;

    @JsonProperty("payment_id")
    String paymentId;

    @JsonProperty("policy")
    String policy;

    @JsonProperty("reversed_cents")
    long reversedCents;

    @JsonProperty("debt_cents")
    long debtCents;

    @JsonProperty("reversal_entry_ids")
    List<UUID> reversalEntryIds;

    @JsonProperty("debts")
    List<TipDebtResponse> debts;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static ChargebackResponse from(ChargebackResult result) {
        return ChargebackResponse.builder()
            .tipTransactionId(result.getTransaction().getId())
            .paymentId(result.getTransaction().getPaymentId())
            .policy(result.getPolicy().name())
            .reversedCents(result.reversedCents())
            .debtCents(result.debtCents())
            .reversalEntryIds(result.getReversals().stream().map(LedgerEntry::getId).toList())
            .debts(result.getDebts().stream().map(TipDebtResponse::from).toList())
            .duplicate(result.isDuplicate())
            .build();
    }
}
