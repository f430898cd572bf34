package com.flagship.tip_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.shift.TimeClockEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TimeClockEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    UUID employeeId;

    @JsonProperty("role")
    String role;

    @JsonProperty("section")
    String section;

    @JsonProperty("clocked_in_at")
    Instant clockedInAt;

    @JsonProperty("clocked_out_at")
    Instant clockedOutAt;

    public static TimeClockEntryResponse from(TimeClockEntry entry) {
        return TimeClockEntryResponse.builder()
            .id(entry.getId())
            .employeeId(entry.getEmployeeId())
            .role(entry.getRole())
            .section(entry.getSection())
            .clockedInAt(entry.getClockedInAt())
            .clockedOutAt(entry.getClockedOutAt())
            .build();
    }
}
