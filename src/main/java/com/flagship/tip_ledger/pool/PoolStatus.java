package com.flagship.tip_ledger.pool;

/**
 * CREATED until the first member joins, ACTIVE afterwards, ENDED for good.
 */
public enum PoolStatus {
    CREATED,
    ACTIVE,
    ENDED
}
