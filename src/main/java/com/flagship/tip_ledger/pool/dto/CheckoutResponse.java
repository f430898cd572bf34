package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.pool.SegmentCheckout;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("segment_id")
    UUID segmentId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    @JsonProperty("member_count")
    int memberCount;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("total_cents")
    long totalCents;

    @JsonProperty("employee_cents")
    Map<UUID, Long> employeeCents;

    public static CheckoutResponse from(SegmentCheckout checkout) {
        return CheckoutResponse.builder()
            .segmentId(checkout.getSegmentId())
            .startedAt(checkout.getStartedAt())
            .endedAt(checkout.getEndedAt())
            .memberCount(checkout.getMemberCount())
            .transactionCount(checkout.getTransactionCount())
            .totalCents(checkout.getTotalCents())
            .employeeCents(checkout.getEmployeeCents())
            .build();
    }
}
