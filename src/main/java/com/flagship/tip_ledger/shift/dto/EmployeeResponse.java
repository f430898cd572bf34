package com.flagship.tip_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.shift.Employee;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EmployeeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("location_id")
    UUID locationId;

    @JsonProperty("display_name")
    String displayName;

    @JsonProperty("role")
    String role;

    @JsonProperty("section")
    String section;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EmployeeResponse from(Employee employee) {
        return EmployeeResponse.builder()
            .id(employee.getId())
            .locationId(employee.getLocationId())
            .displayName(employee.getDisplayName())
            .role(employee.getRole())
            .section(employee.getSection())
            .active(employee.isActive())
            .createdAt(employee.getCreatedAt())
            .build();
    }
}
