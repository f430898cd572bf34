package com.flagship.tip_ledger.shift;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Who works here, in which role, and who is on the clock.
 */
public interface ShiftDirectory {

    /**
     * True when the employee is clocked in as {@code role} at {@code at}.
     * A null section on either side matches any section.
     */
    boolean isOnDuty(UUID employeeId, String role, String section, Instant at);

    Optional<String> roleOf(UUID employeeId);

    /**
     * Active employees of {@code role} at the location working {@code section},
     * ordered by id.
     */
    List<Employee> recipientsFor(UUID locationId, String role, String section);
}
