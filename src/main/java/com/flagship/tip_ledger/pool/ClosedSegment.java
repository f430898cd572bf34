package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An immutable past segment, {@code [startedAt, endedAt)}.
 */
@Value
public class ClosedSegment implements PoolSegment {
    UUID id;
    UUID poolId;
    Instant startedAt;
    Instant endedAt;
    List<SegmentShare> shares;

    @Override
    public boolean covers(Instant instant) {
        return !instant.isBefore(startedAt) && instant.isBefore(endedAt);
    }
}
