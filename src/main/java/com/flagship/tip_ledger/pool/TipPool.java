package com.flagship.tip_ledger.pool;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A named group sharing tips over {@code [createdAt, endedAt)}.
 *
 * {@code currentSegmentId} is the single open segment while the pool is not
 * ended. It only changes under the pool row lock, and every update checks the
 * value it expects to replace.
 */
@Value
public class TipPool {
    UUID id;
    UUID locationId;
    String name;
    UUID ownerEmployeeId;
    SplitMode splitMode;
    PoolStatus status;
    UUID currentSegmentId;
    Instant createdAt;
    Instant endedAt;

    public boolean isEnded() {
        return status == PoolStatus.ENDED;
    }
}
