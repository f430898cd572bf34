package com.flagship.tip_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Clock-in or clock-out. Role and section default to the employee's own;
 * {@code at} defaults to now.
 */
@Value
@Builder
@Jacksonized
public class ClockRequest {

    @JsonProperty("role")
    String role;

    @JsonProperty("section")
    String section;

    @JsonProperty("at")
    Instant at;
}
