package com.flagship.tip_ledger.pool;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Structural check of a pool's segment list: ordered, contiguous, no overlap,
 * spanning {@code [createdAt, endedAt)} with at most one open segment at the end.
 */
public final class PoolTimeline {

    private PoolTimeline() {
    }

    /**
     * @param segments ordered by start
     * @return a description of the first defect, or empty when the timeline is sound
     */
    public static Optional<String> findDefect(TipPool pool, List<PoolSegment> segments) {
        if (segments.isEmpty()) {
            return Optional.of("pool has no segments");
        }
        if (!segments.get(0).getStartedAt().equals(pool.getCreatedAt())) {
            return Optional.of("first segment starts at " + segments.get(0).getStartedAt()
                + " but pool was created at " + pool.getCreatedAt());
        }
        Instant expectedStart = pool.getCreatedAt();
        for (int i = 0; i < segments.size(); i++) {
            PoolSegment segment = segments.get(i);
            if (!segment.getStartedAt().equals(expectedStart)) {
                return Optional.of("segment " + segment.getId() + " starts at " + segment.getStartedAt()
                    + ", expected " + expectedStart + " (gap or overlap)");
            }
            boolean last = i == segments.size() - 1;
            if (segment instanceof OpenSegment) {
                if (!last) {
                    return Optional.of("open segment " + segment.getId() + " is not the latest");
                }
                if (pool.isEnded()) {
                    return Optional.of("ended pool still has open segment " + segment.getId());
                }
                if (!segment.getId().equals(pool.getCurrentSegmentId())) {
                    return Optional.of("current segment pointer " + pool.getCurrentSegmentId()
                        + " does not match open segment " + segment.getId());
                }
                return Optional.empty();
            }
            expectedStart = ((ClosedSegment) segment).getEndedAt();
        }
        if (!pool.isEnded()) {
            return Optional.of("pool is not ended but has no open segment");
        }
        if (!expectedStart.equals(pool.getEndedAt())) {
            return Optional.of("last segment ends at " + expectedStart + " but pool ended at " + pool.getEndedAt());
        }
        return Optional.empty();
    }
}
