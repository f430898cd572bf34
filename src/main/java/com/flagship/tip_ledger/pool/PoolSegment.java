package com.flagship.tip_ledger.pool;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A stretch of a pool's life with constant membership and ratios.
 *
 * A segment is either {@link OpenSegment} (the pool's current one) or
 * {@link ClosedSegment}. Ratios are frozen at creation and never recomputed.
 */
public sealed interface PoolSegment permits OpenSegment, ClosedSegment {

    UUID getId();

    UUID getPoolId();

    Instant getStartedAt();

    /**
     * Members and ratios ordered by ascending employee id; ratios sum to exactly 1
     * unless the list is empty.
     */
    List<SegmentShare> getShares();

    /**
     * Whether {@code instant} falls in this segment's half-open interval.
     */
    boolean covers(Instant instant);

    default int memberCount() {
        return getShares().size();
    }

    default boolean isEmpty() {
        return getShares().isEmpty();
    }
}
