package com.flagship.tip_ledger.pool;

import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.observability.CorrelationContext;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.shift.ShiftDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps each pool's segment timeline gap-free.
 *
 * Every membership change locks the pool row, closes the open segment at the
 * change instant, opens the next one with freshly frozen ratios and swaps the
 * current segment pointer, all in one transaction. The resulting timeline is
 * re-checked before commit; a defect aborts the change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolService {

    private final PoolRepository repository;
    private final ShiftDirectory shiftDirectory;
    private final TransactionRunner transactionRunner;
    private final TipMetrics metrics;

    /**
     * Creates a pool whose first segment starts at {@code createdAt} with the
     * given members.
     */
    public TipPool createPool(UUID locationId, String name, UUID ownerEmployeeId, SplitMode splitMode,
                              Instant createdAt, List<PoolMemberRequest> initialMembers) {
        if (locationId == null || ownerEmployeeId == null || splitMode == null || createdAt == null) {
            throw TipLedgerException.validation("Location, owner, split mode and creation time are required");
        }
        if (name == null || name.isBlank()) {
            throw TipLedgerException.validation("Pool name is required");
        }
        List<PoolMemberRequest> members = initialMembers == null ? List.of() : initialMembers;
        Set<UUID> distinct = new HashSet<>();
        for (PoolMemberRequest member : members) {
            requireEmployee(member.employeeId());
            if (!distinct.add(member.employeeId())) {
                throw TipLedgerException.of(ErrorKind.ALREADY_MEMBER,
                    "Employee %s listed twice in pool %s", member.employeeId(), name);
            }
        }
        requireEmployee(ownerEmployeeId);

        UUID poolId = UUID.randomUUID();
        PoolStatus status = members.isEmpty() ? PoolStatus.CREATED : PoolStatus.ACTIVE;
        TipPool draft = new TipPool(poolId, locationId, name.trim(), ownerEmployeeId, splitMode, status,
            null, createdAt, null);

        return transactionRunner.inTransaction("create pool", () -> {
            repository.insertPool(draft);

            List<PoolMembership> memberships = new ArrayList<>();
            for (PoolMemberRequest member : members) {
                PoolMembership membership = new PoolMembership(UUID.randomUUID(), poolId, member.employeeId(),
                    weightFor(splitMode, member.weight()), createdAt, null);
                repository.insertMembership(membership);
                memberships.add(membership);
            }

            OpenSegment first = new OpenSegment(UUID.randomUUID(), poolId, createdAt,
                SplitRatios.compute(splitMode, memberships));
            repository.insertSegment(first);
            if (!repository.attachFirstSegment(poolId, first.getId())) {
                throw integrityViolation(poolId, "first segment could not be attached");
            }

            TipPool created = verifiedPool(poolId);
            log.info("Created pool {} '{}' ({}) with {} members at {}",
                poolId, created.getName(), splitMode, memberships.size(), createdAt);
            metrics.recordPoolChange("create");
            return created;
        });
    }

    /**
     * Adds the employee from {@code at} onwards.
     *
     * @param weight share value for weighted pools; ignored for equal pools
     */
    public PoolSegment join(UUID poolId, UUID employeeId, BigDecimal weight, Instant at) {
        requireEmployee(employeeId);
        requireInstant(at);

        try (MDC.MDCCloseable ignored = CorrelationContext.scoped(CorrelationContext.POOL_ID_MDC_KEY, poolId)) {
            return transactionRunner.inTransaction("pool join", () -> {
                TipPool pool = lockOpenPool(poolId);
                if (repository.findOpenMembership(poolId, employeeId).isPresent()) {
                    throw TipLedgerException.of(ErrorKind.ALREADY_MEMBER,
                        "Employee %s is already a member of pool %s", employeeId, poolId);
                }
                OpenSegment current = currentSegment(pool);
                requireNotBefore(at, current.getStartedAt(), "join");

                repository.insertMembership(new PoolMembership(UUID.randomUUID(), poolId, employeeId,
                    weightFor(pool.getSplitMode(), weight), at, null));

                OpenSegment next = rotate(pool, current, at);
                log.info("Employee {} joined pool {} at {}; segment {} now has {} members",
                    employeeId, poolId, at, next.getId(), next.memberCount());
                metrics.recordPoolChange("join");
                return next;
            });
        }
    }

    /**
     * Removes the employee from {@code at} onwards. The pool stays open even
     * when this empties it.
     */
    public PoolSegment leave(UUID poolId, UUID employeeId, Instant at) {
        requireInstant(at);

        try (MDC.MDCCloseable ignored = CorrelationContext.scoped(CorrelationContext.POOL_ID_MDC_KEY, poolId)) {
            return transactionRunner.inTransaction("pool leave", () -> {
                TipPool pool = lockOpenPool(poolId);
                PoolMembership membership = repository.findOpenMembership(poolId, employeeId)
                    .orElseThrow(() -> TipLedgerException.of(ErrorKind.NOT_MEMBER,
                        "Employee %s is not a member of pool %s", employeeId, poolId));
                OpenSegment current = currentSegment(pool);
                requireNotBefore(at, current.getStartedAt(), "leave");
                requireNotBefore(at, membership.getJoinedAt(), "leave");

                repository.closeMembership(membership.getId(), at);

                OpenSegment next = rotate(pool, current, at);
                log.info("Employee {} left pool {} at {}; segment {} now has {} members",
                    employeeId, poolId, at, next.getId(), next.memberCount());
                metrics.recordPoolChange("leave");
                return next;
            });
        }
    }

    /**
     * Closes the last segment and every open membership at {@code at}; the pool
     * is immutable afterwards.
     */
    public TipPool end(UUID poolId, Instant at) {
        requireInstant(at);

        return transactionRunner.inTransaction("pool end", () -> {
            TipPool pool = lockOpenPool(poolId);
            OpenSegment current = currentSegment(pool);
            requireNotBefore(at, current.getStartedAt(), "end");

            for (PoolMembership membership : repository.findOpenMemberships(poolId)) {
                repository.closeMembership(membership.getId(), at);
            }
            if (!repository.closeSegment(current.getId(), at)
                    || !repository.markEnded(poolId, current.getId(), at)) {
                throw integrityViolation(poolId, "segment " + current.getId() + " changed while ending the pool");
            }

            TipPool ended = verifiedPool(poolId);
            log.info("Pool {} ended at {}", poolId, at);
            metrics.recordPoolChange("end");
            return ended;
        });
    }

    /**
     * Hands the pool to another current member.
     */
    public TipPool transferOwnership(UUID poolId, UUID newOwnerEmployeeId) {
        return transactionRunner.inTransaction("pool ownership", () -> {
            TipPool pool = lockOpenPool(poolId);
            if (repository.findOpenMembership(poolId, newOwnerEmployeeId).isEmpty()) {
                throw TipLedgerException.of(ErrorKind.NOT_MEMBER,
                    "New owner %s is not a member of pool %s", newOwnerEmployeeId, poolId);
            }
            repository.updateOwner(poolId, newOwnerEmployeeId);
            log.info("Pool {} ownership moved from {} to {}", poolId, pool.getOwnerEmployeeId(), newOwnerEmployeeId);
            return getPool(poolId);
        });
    }

    // ==================== Reads ====================

    /**
     * The segment covering {@code instant}.
     *
     * @throws TipLedgerException NO_ACTIVE_SEGMENT when the pool ended at or before
     *         {@code instant}; SEGMENT_NOT_FOUND when {@code instant} precedes the pool
     */
    public PoolSegment segmentAt(UUID poolId, Instant instant) {
        requireInstant(instant);
        TipPool pool = getPool(poolId);
        if (instant.isBefore(pool.getCreatedAt())) {
            throw TipLedgerException.of(ErrorKind.SEGMENT_NOT_FOUND,
                "Pool %s did not exist yet at %s (created %s)", poolId, instant, pool.getCreatedAt());
        }
        if (pool.isEnded() && !instant.isBefore(pool.getEndedAt())) {
            throw TipLedgerException.of(ErrorKind.NO_ACTIVE_SEGMENT,
                "Pool %s ended at %s, before %s", poolId, pool.getEndedAt(), instant);
        }
        return repository.findSegmentAt(poolId, instant)
            .orElseThrow(() -> integrityViolation(poolId, "no segment covers " + instant));
    }

    /**
     * {@link #segmentAt} under a shared pool lock, so the segment cannot be split
     * by a join or leave before the caller's transaction commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PoolSegment segmentForAttribution(UUID poolId, Instant instant) {
        repository.sharePool(poolId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_POOL, "Pool not found: %s", poolId));
        return segmentAt(poolId, instant);
    }

    /**
     * The pool an employee was working in at {@code instant}, if any. Direct
     * tips for that employee are routed into it.
     */
    public Optional<UUID> activePoolOf(UUID locationId, UUID employeeId, Instant instant) {
        requireInstant(instant);
        return repository.findPoolOfMemberAt(locationId, employeeId, instant);
    }

    public TipPool getPool(UUID poolId) {
        return repository.findPool(poolId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_POOL, "Pool not found: %s", poolId));
    }

    public List<TipPool> poolsAt(UUID locationId) {
        return repository.findPoolsByLocation(locationId);
    }

    public List<PoolSegment> segments(UUID poolId) {
        getPool(poolId);
        return repository.findSegments(poolId);
    }

    public List<PoolMembership> memberships(UUID poolId) {
        getPool(poolId);
        return repository.findMemberships(poolId);
    }

    /**
     * Fails with INTEGRITY_VIOLATION if the stored timeline has a gap, an overlap
     * or a stale current segment pointer.
     */
    public List<PoolSegment> verifyTimeline(UUID poolId) {
        TipPool pool = getPool(poolId);
        List<PoolSegment> segments = repository.findSegments(poolId);
        PoolTimeline.findDefect(pool, segments).ifPresent(defect -> {
            throw integrityViolation(poolId, defect);
        });
        return segments;
    }

    /**
     * Per-segment breakdown of tips collected in {@code [from, to)}.
     */
    public List<SegmentCheckout> checkout(UUID poolId, Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw TipLedgerException.validation("Checkout range must have from < to");
        }
        getPool(poolId);

        Map<UUID, List<PoolRepository.CheckoutRow>> bySegment = new LinkedHashMap<>();
        for (PoolRepository.CheckoutRow row : repository.checkoutRows(poolId, from, to)) {
            bySegment.computeIfAbsent(row.segmentId(), id -> new ArrayList<>()).add(row);
        }

        List<SegmentCheckout> result = new ArrayList<>();
        for (PoolSegment segment : repository.findSegments(poolId)) {
            List<PoolRepository.CheckoutRow> rows = bySegment.getOrDefault(segment.getId(), List.of());
            if (rows.isEmpty()) {
                continue;
            }
            Map<UUID, Long> perEmployee = new LinkedHashMap<>();
            long transactions = 0;
            for (PoolRepository.CheckoutRow row : rows) {
                perEmployee.merge(row.employeeId(), row.cents(), Long::sum);
                transactions = Math.max(transactions, row.transactionCount());
            }
            long total = perEmployee.values().stream().mapToLong(Long::longValue).sum();
            Instant endedAt = segment instanceof ClosedSegment closed ? closed.getEndedAt() : null;
            result.add(new SegmentCheckout(segment.getId(), segment.getStartedAt(), endedAt,
                segment.memberCount(), transactions, total, perEmployee));
        }
        return result;
    }

    // ==================== Internals ====================

    private OpenSegment rotate(TipPool pool, OpenSegment current, Instant at) {
        if (!repository.closeSegment(current.getId(), at)) {
            throw integrityViolation(pool.getId(), "segment " + current.getId() + " was already closed");
        }
        OpenSegment next = new OpenSegment(UUID.randomUUID(), pool.getId(), at,
            SplitRatios.compute(pool.getSplitMode(), repository.findOpenMemberships(pool.getId())));
        repository.insertSegment(next);

        if (!repository.moveCurrentSegment(pool.getId(), current.getId(), next.getId(), PoolStatus.ACTIVE)) {
            throw integrityViolation(pool.getId(), "current segment moved away from " + current.getId());
        }
        verifiedPool(pool.getId());
        return next;
    }

    private TipPool lockOpenPool(UUID poolId) {
        TipPool pool = repository.lockPool(poolId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_POOL, "Pool not found: %s", poolId));
        if (pool.isEnded()) {
            throw TipLedgerException.of(ErrorKind.POOL_CLOSED, "Pool %s ended at %s", poolId, pool.getEndedAt());
        }
        return pool;
    }

    private OpenSegment currentSegment(TipPool pool) {
        PoolSegment segment = pool.getCurrentSegmentId() == null ? null
            : repository.findSegment(pool.getCurrentSegmentId()).orElse(null);
        if (segment instanceof OpenSegment open) {
            return open;
        }
        throw integrityViolation(pool.getId(), "current segment pointer " + pool.getCurrentSegmentId()
            + " does not reference an open segment");
    }

    private TipPool verifiedPool(UUID poolId) {
        TipPool pool = getPool(poolId);
        PoolTimeline.findDefect(pool, repository.findSegments(poolId)).ifPresent(defect -> {
            throw integrityViolation(poolId, defect);
        });
        return pool;
    }

    private BigDecimal weightFor(SplitMode mode, BigDecimal requested) {
        try {
            return SplitRatios.weightFor(mode, requested);
        } catch (IllegalArgumentException e) {
            throw new TipLedgerException(ErrorKind.VALIDATION, e.getMessage(), e);
        }
    }

    private void requireEmployee(UUID employeeId) {
        if (employeeId == null) {
            throw TipLedgerException.validation("Employee id is required");
        }
        if (shiftDirectory.roleOf(employeeId).isEmpty()) {
            throw TipLedgerException.of(ErrorKind.UNKNOWN_EMPLOYEE, "Employee not found: %s", employeeId);
        }
    }

    private static void requireInstant(Instant at) {
        if (at == null) {
            throw TipLedgerException.validation("Timestamp is required");
        }
    }

    private static void requireNotBefore(Instant at, Instant boundary, String action) {
        if (at.isBefore(boundary)) {
            throw TipLedgerException.validation("Cannot %s at %s, before %s", action, at, boundary);
        }
    }

    private TipLedgerException integrityViolation(UUID poolId, String defect) {
        log.error("Refusing change to pool {}: {}", poolId, defect);
        metrics.recordIntegrityViolation("pool_timeline");
        return TipLedgerException.of(ErrorKind.INTEGRITY_VIOLATION, "Pool %s timeline defect: %s", poolId, defect);
    }
}
