package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Tips credited through one segment, per employee.
 */
@Value
public class SegmentCheckout {
    UUID segmentId;
    Instant startedAt;
    Instant endedAt;
    int memberCount;
    long transactionCount;
    long totalCents;
    Map<UUID, Long> employeeCents;
}
