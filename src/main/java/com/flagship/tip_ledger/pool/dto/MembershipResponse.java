package com.flagship.tip_ledger.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.pool.PoolMembership;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MembershipResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("weight")
    BigDecimal weight;

    @JsonProperty("joined_at")
    Instant joinedAt;

    @JsonProperty("left_at")
    Instant leftAt;

    public static MembershipResponse from(PoolMembership membership) {
        return MembershipResponse.builder()
            .id(membership.getId())
            .employeeId(membership.getEmployeeId())
            .weight(membership.getWeight())
            .joinedAt(membership.getJoinedAt())
            .leftAt(membership.getLeftAt())
            .build();
    }
}
