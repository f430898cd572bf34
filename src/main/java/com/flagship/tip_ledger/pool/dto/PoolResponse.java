package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.pool.TipPool;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PoolResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("name")
    String name;

    @JsonProperty("owner_employee_id")
    UUID ownerEmployeeId;

    @JsonProperty("split_mode")
    String splitMode;

    @JsonProperty("status")
    String status;

    @JsonProperty("current_segment_id")
    UUID currentSegmentId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    public static PoolResponse from(TipPool pool) {
        return PoolResponse.builder()
            .id(pool.getId())
            .locationId(pool.getLocationId())
            .name(pool.getName())
            .ownerEmployeeId(pool.getOwnerEmployeeId())
            .splitMode(pool.getSplitMode().name())
            .status(pool.getStatus().name())
            .currentSegmentId(pool.getCurrentSegmentId())
            .createdAt(pool.getCreatedAt())
            .endedAt(pool.getEndedAt())
            .build();
    }
}
