package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The pool's current segment, {@code [startedAt, ∞)} until closed.
 */
@Value
public class OpenSegment implements PoolSegment {
    UUID id;
    UUID poolId;
    Instant startedAt;
    List<SegmentShare> shares;

    @Override
    public boolean covers(Instant instant) {
        return !instant.isBefore(startedAt);
    }

    /**
     * Freezes this segment at {@code endedAt}.
     */
    public ClosedSegment closeAt(Instant endedAt) {
        if (endedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException(
                "Segment " + id + " cannot end at " + endedAt + " before it started at " + startedAt);
        }
        return new ClosedSegment(id, poolId, startedAt, endedAt, shares);
    }
}
