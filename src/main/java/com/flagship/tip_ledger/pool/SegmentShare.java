package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Frozen split ratio of one member within one segment.
 */
@Value
public class SegmentShare {
    UUID employeeId;
    BigDecimal ratio;
}
