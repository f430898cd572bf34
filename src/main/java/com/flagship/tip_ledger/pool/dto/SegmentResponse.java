package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.pool.ClosedSegment;
import com.flagship.tip_ledger.pool.PoolSegment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SegmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("pool_id")
    UUID poolId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    @JsonProperty("open")
    boolean open;

    @JsonProperty("shares")
    List<Share> shares;

    public static SegmentResponse from(PoolSegment segment) {
        Instant endedAt = segment instanceof ClosedSegment closed ? closed.getEndedAt() : null;
        return SegmentResponse.builder()
            .id(segment.getId())
            .poolId(segment.getPoolId())
            .startedAt(segment.getStartedAt())
            .endedAt(endedAt)
            .open(endedAt == null)
            .shares(segment.getShares().stream()
                .map(share -> new Share(share.getEmployeeId(), share.getRatio()))
                .toList())
            .build();
    }

    @Value
    public static class Share {
        @JsonProperty("employee_id")
        UUID employeeId;

        @JsonProperty("ratio")
        BigDecimal ratio;
    }
}
