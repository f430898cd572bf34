package com.flagship.tip_ledger.pool;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param weight share value for weighted pools; ignored by equal pools, defaults to 1
 */
public record PoolMemberRequest(UUID employeeId, BigDecimal weight) {

    public static PoolMemberRequest of(UUID employeeId) {
        return new PoolMemberRequest(employeeId, null);
    }
}
