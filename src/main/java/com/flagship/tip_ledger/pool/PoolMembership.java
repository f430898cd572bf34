package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One continuous stay of an employee in a pool. {@code leftAt} is null while it lasts.
 */
@Value
public class PoolMembership {
    UUID id;
    UUID poolId;
    UUID employeeId;
    BigDecimal weight;
    Instant joinedAt;
    Instant leftAt;

    public boolean isOpen() {
        return leftAt == null;
    }
}
