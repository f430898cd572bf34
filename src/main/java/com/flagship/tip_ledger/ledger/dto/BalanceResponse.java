package com.flagship.tip_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.ledger.LedgerAccount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("balance_cents")
    long balanceCents;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(LedgerAccount account) {
        return BalanceResponse.builder()
            .accountId(account.getId())
            .employeeId(account.getEmployeeId())
            .locationId(account.getLocationId())
            .balanceCents(account.getBalanceCents())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
