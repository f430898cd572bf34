package com.flagship.tip_ledger.pool;

import com.flagship.tip_ledger.common.IdOrder;
import com.flagship.tip_ledger.common.JdbcTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to pools, memberships and segments.
 */
@Repository
@RequiredArgsConstructor
public class PoolRepository {

    private static final String POOL_COLUMNS = """
        id, location_id, name, owner_employee_id, split_mode, status, current_segment_id, created_at, ended_at
        """;

    private static final String MEMBERSHIP_COLUMNS = "id, pool_id, employee_id, weight, joined_at, left_at";

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<TipPool> poolMapper = (rs, rowNum) -> new TipPool(
        rs.getObject("id", UUID.class),
        rs.getObject("location_id", UUID.class),
        rs.getString("name"),
        rs.getObject("owner_employee_id", UUID.class),
        SplitMode.valueOf(rs.getString("split_mode")),
        PoolStatus.valueOf(rs.getString("status")),
        rs.getObject("current_segment_id", UUID.class),
        JdbcTimestamps.read(rs, "created_at"),
        JdbcTimestamps.read(rs, "ended_at")
    );

    private final RowMapper<PoolMembership> membershipMapper = (rs, rowNum) -> new PoolMembership(
        rs.getObject("id", UUID.class),
        rs.getObject("pool_id", UUID.class),
        rs.getObject("employee_id", UUID.class),
        rs.getBigDecimal("weight"),
        JdbcTimestamps.read(rs, "joined_at"),
        JdbcTimestamps.read(rs, "left_at")
    );

    // ==================== Pools ====================

    public void insertPool(TipPool pool) {
        jdbcTemplate.update("""
            INSERT INTO tip_pools
                (id, location_id, name, owner_employee_id, split_mode, status, current_segment_id, created_at, ended_at)
            VALUES (?, ?, ?, ?, ?, ?, NULL, ?, NULL)
            """,
            pool.getId(), pool.getLocationId(), pool.getName(), pool.getOwnerEmployeeId(),
            pool.getSplitMode().name(), pool.getStatus().name(), JdbcTimestamps.of(pool.getCreatedAt()));
    }

    public Optional<TipPool> findPool(UUID poolId) {
        return jdbcTemplate.query("SELECT " + POOL_COLUMNS + " FROM tip_pools WHERE id = ?", poolMapper, poolId)
            .stream().findFirst();
    }

    /**
     * Serializes every membership change of one pool.
     */
    public Optional<TipPool> lockPool(UUID poolId) {
        return jdbcTemplate.query("SELECT " + POOL_COLUMNS + " FROM tip_pools WHERE id = ? FOR UPDATE",
            poolMapper, poolId).stream().findFirst();
    }

    /**
     * Blocks membership changes, but not other attributions, until commit.
     */
    public Optional<TipPool> sharePool(UUID poolId) {
        return jdbcTemplate.query("SELECT " + POOL_COLUMNS + " FROM tip_pools WHERE id = ? FOR SHARE",
            poolMapper, poolId).stream().findFirst();
    }

    public List<TipPool> findPoolsByLocation(UUID locationId) {
        return jdbcTemplate.query(
            "SELECT " + POOL_COLUMNS + " FROM tip_pools WHERE location_id = ? ORDER BY created_at",
            poolMapper, locationId);
    }

    /**
     * Swaps the current segment pointer, but only from the expected value.
     *
     * @return false when the pointer no longer holds {@code expectedSegmentId}
     */
    public boolean moveCurrentSegment(UUID poolId, UUID expectedSegmentId, UUID newSegmentId, PoolStatus status) {
        int rows = jdbcTemplate.update("""
            UPDATE tip_pools SET current_segment_id = ?, status = ?
            WHERE id = ? AND current_segment_id = ?
            """,
            newSegmentId, status.name(), poolId, expectedSegmentId);
        return rows == 1;
    }

    public boolean attachFirstSegment(UUID poolId, UUID segmentId) {
        int rows = jdbcTemplate.update(
            "UPDATE tip_pools SET current_segment_id = ? WHERE id = ? AND current_segment_id IS NULL",
            segmentId, poolId);
        return rows == 1;
    }

    public boolean markEnded(UUID poolId, UUID expectedSegmentId, Instant endedAt) {
        int rows = jdbcTemplate.update("""
            UPDATE tip_pools SET status = 'ENDED', current_segment_id = NULL, ended_at = ?
            WHERE id = ? AND current_segment_id = ? AND status <> 'ENDED'
            """,
            JdbcTimestamps.of(endedAt), poolId, expectedSegmentId);
        return rows == 1;
    }

    public void updateOwner(UUID poolId, UUID ownerEmployeeId) {
        jdbcTemplate.update("UPDATE tip_pools SET owner_employee_id = ? WHERE id = ?", ownerEmployeeId, poolId);
    }

    // ==================== Memberships ====================

    public void insertMembership(PoolMembership membership) {
        jdbcTemplate.update("""
            INSERT INTO pool_memberships (id, pool_id, employee_id, weight, joined_at, left_at)
            VALUES (?, ?, ?, ?, ?, NULL)
            """,
            membership.getId(), membership.getPoolId(), membership.getEmployeeId(), membership.getWeight(),
            JdbcTimestamps.of(membership.getJoinedAt()));
    }

    public Optional<PoolMembership> findOpenMembership(UUID poolId, UUID employeeId) {
        return jdbcTemplate.query(
            "SELECT " + MEMBERSHIP_COLUMNS + " FROM pool_memberships WHERE pool_id = ? AND employee_id = ? AND left_at IS NULL",
            membershipMapper, poolId, employeeId).stream().findFirst();
    }

    public List<PoolMembership> findOpenMemberships(UUID poolId) {
        return jdbcTemplate.query(
            "SELECT " + MEMBERSHIP_COLUMNS + " FROM pool_memberships WHERE pool_id = ? AND left_at IS NULL",
            membershipMapper, poolId);
    }

    public List<PoolMembership> findMemberships(UUID poolId) {
        return jdbcTemplate.query(
            "SELECT " + MEMBERSHIP_COLUMNS + " FROM pool_memberships WHERE pool_id = ? ORDER BY joined_at, employee_id",
            membershipMapper, poolId);
    }

    public void closeMembership(UUID membershipId, Instant leftAt) {
        jdbcTemplate.update("UPDATE pool_memberships SET left_at = ? WHERE id = ? AND left_at IS NULL",
            JdbcTimestamps.of(leftAt), membershipId);
    }

    // ==================== Segments ====================

    public void insertSegment(OpenSegment segment) {
        jdbcTemplate.update("""
            INSERT INTO pool_segments (id, pool_id, started_at, ended_at, member_count)
            VALUES (?, ?, ?, NULL, ?)
            """,
            segment.getId(), segment.getPoolId(), JdbcTimestamps.of(segment.getStartedAt()), segment.memberCount());

        List<Object[]> rows = new ArrayList<>();
        for (SegmentShare share : segment.getShares()) {
            rows.add(new Object[]{segment.getId(), share.getEmployeeId(), share.getRatio()});
        }
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(
                "INSERT INTO pool_segment_shares (segment_id, employee_id, ratio) VALUES (?, ?, ?)", rows);
        }
    }

    /**
     * Closes a segment that is still open.
     *
     * @return false if it was already closed
     */
    public boolean closeSegment(UUID segmentId, Instant endedAt) {
        int rows = jdbcTemplate.update(
            "UPDATE pool_segments SET ended_at = ? WHERE id = ? AND ended_at IS NULL",
            JdbcTimestamps.of(endedAt), segmentId);
        return rows == 1;
    }

    public Optional<PoolSegment> findSegment(UUID segmentId) {
        return jdbcTemplate.query(
            "SELECT id, pool_id, started_at, ended_at FROM pool_segments WHERE id = ?",
            this::mapSegmentHeader, segmentId).stream().findFirst().map(this::withShares);
    }

    /**
     * The segment whose {@code [started_at, ended_at)} contains {@code instant}.
     */
    public Optional<PoolSegment> findSegmentAt(UUID poolId, Instant instant) {
        return jdbcTemplate.query("""
            SELECT id, pool_id, started_at, ended_at FROM pool_segments
            WHERE pool_id = ? AND started_at <= ? AND (ended_at IS NULL OR ended_at > ?)
            ORDER BY started_at DESC
            """,
            this::mapSegmentHeader, poolId, JdbcTimestamps.of(instant), JdbcTimestamps.of(instant))
            .stream().findFirst().map(this::withShares);
    }

    /**
     * The pool at {@code locationId} that {@code employeeId} belonged to at
     * {@code instant}, latest membership first.
     */
    public Optional<UUID> findPoolOfMemberAt(UUID locationId, UUID employeeId, Instant instant) {
        Timestamp at = JdbcTimestamps.of(instant);
        return jdbcTemplate.query("""
            SELECT m.pool_id FROM pool_memberships m
            JOIN tip_pools p ON p.id = m.pool_id
            WHERE p.location_id = ? AND m.employee_id = ?
              AND m.joined_at <= ? AND (m.left_at IS NULL OR m.left_at > ?)
              AND (p.ended_at IS NULL OR p.ended_at > ?)
            ORDER BY m.joined_at DESC, m.pool_id
            LIMIT 1
            """,
            (rs, rowNum) -> rs.getObject("pool_id", UUID.class),
            locationId, employeeId, at, at, at).stream().findFirst();
    }

    public List<PoolSegment> findSegments(UUID poolId) {
        return jdbcTemplate.query(
            "SELECT id, pool_id, started_at, ended_at FROM pool_segments WHERE pool_id = ? ORDER BY started_at, ended_at NULLS LAST",
            this::mapSegmentHeader, poolId).stream().map(this::withShares).toList();
    }

    /**
     * Per segment and employee: credited cents and transaction count of tips
     * collected in {@code [from, to)}.
     */
    public List<CheckoutRow> checkoutRows(UUID poolId, Instant from, Instant to) {
        return jdbcTemplate.query("""
            SELECT t.segment_id, a.employee_id, SUM(e.amount_cents) AS cents, COUNT(DISTINCT t.id) AS tx_count
            FROM tip_transactions t
            JOIN ledger_entries e ON e.source_id = t.id AND e.source_type = 'TIP_TRANSACTION'
            JOIN ledger_accounts a ON a.id = e.account_id
            WHERE t.pool_id = ? AND t.collected_at >= ? AND t.collected_at < ?
            GROUP BY t.segment_id, a.employee_id
            """,
            (rs, rowNum) -> new CheckoutRow(
                rs.getObject("segment_id", UUID.class),
                rs.getObject("employee_id", UUID.class),
                rs.getLong("cents"),
                rs.getLong("tx_count")),
            poolId, JdbcTimestamps.of(from), JdbcTimestamps.of(to));
    }

    public record CheckoutRow(UUID segmentId, UUID employeeId, long cents, long transactionCount) {
    }

    private SegmentHeader mapSegmentHeader(ResultSet rs, int rowNum) throws SQLException {
        return new SegmentHeader(
            rs.getObject("id", UUID.class),
            rs.getObject("pool_id", UUID.class),
            JdbcTimestamps.read(rs, "started_at"),
            JdbcTimestamps.read(rs, "ended_at"));
    }

    private PoolSegment withShares(SegmentHeader header) {
        List<SegmentShare> shares = jdbcTemplate.query(
            "SELECT employee_id, ratio FROM pool_segment_shares WHERE segment_id = ?",
            (rs, rowNum) -> new SegmentShare(rs.getObject("employee_id", UUID.class), rs.getBigDecimal("ratio")),
            header.id());
        List<SegmentShare> ordered = shares.stream()
            .sorted(Comparator.comparing(SegmentShare::getEmployeeId, IdOrder.ASCENDING))
            .toList();
        return header.endedAt() == null
            ? new OpenSegment(header.id(), header.poolId(), header.startedAt(), ordered)
            : new ClosedSegment(header.id(), header.poolId(), header.startedAt(), header.endedAt(), ordered);
    }

    private record SegmentHeader(UUID id, UUID poolId, Instant startedAt, Instant endedAt) {
    }
}
