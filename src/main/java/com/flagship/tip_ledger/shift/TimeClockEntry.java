package com.flagship.tip_ledger.shift;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One clocked stint of an employee in a role, {@code [clockedInAt, clockedOutAt)}.
 */
@Value
public class TimeClockEntry {
    UUID id;
    UUID employeeId;
    String role;
    String section;
    Instant clockedInAt;
    Instant clockedOutAt;

    public boolean covers(Instant at) {
        return !clockedInAt.isAfter(at) && (clockedOutAt == null || clockedOutAt.isAfter(at));
    }
}
