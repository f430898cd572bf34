package com.flagship.tip_ledger.ledger;

import com.flagship.tip_ledger.common.JdbcTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to accounts and entries.
 *
 * Row locks are taken with {@code SELECT ... FOR UPDATE}; callers must hold a
 * transaction.
 */
@Repository
@RequiredArgsConstructor
public class LedgerRepository {

    private static final String ENTRY_COLUMNS = """
        id, account_id, amount_cents, source_type, source_id, idempotency_key,
        reverses_entry_id, memo, created_at, sequence_number
        """;

    private static final String ACCOUNT_COLUMNS =
        "id, employee_id, location_id, balance_cents, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<LedgerAccount> accountMapper = (rs, rowNum) -> new LedgerAccount(
        rs.getObject("id", UUID.class),
        rs.getObject("employee_id", UUID.class),
        rs.getObject("location_id", UUID.class),
        rs.getLong("balance_cents"),
        JdbcTimestamps.read(rs, "created_at"),
        JdbcTimestamps.read(rs, "updated_at")
    );

    private final RowMapper<LedgerEntry> entryMapper = (rs, rowNum) -> new LedgerEntry(
        rs.getObject("id", UUID.class),
        rs.getObject("account_id", UUID.class),
        rs.getLong("amount_cents"),
        EntrySourceType.valueOf(rs.getString("source_type")),
        rs.getObject("source_id", UUID.class),
        rs.getString("idempotency_key"),
        rs.getObject("reverses_entry_id", UUID.class),
        rs.getString("memo"),
        JdbcTimestamps.read(rs, "created_at"),
        rs.getLong("sequence_number")
    );

    // ==================== Accounts ====================

    public void insertAccountIfAbsent(UUID employeeId, UUID locationId) {
        Instant now = Instant.now();
        jdbcTemplate.update("""
            INSERT INTO ledger_accounts (id, employee_id, location_id, balance_cents, created_at, updated_at)
            VALUES (?, ?, ?, 0, ?, ?)
            ON CONFLICT (employee_id, location_id) DO NOTHING
            """,
            UUID.randomUUID(), employeeId, locationId, JdbcTimestamps.of(now), JdbcTimestamps.of(now));
    }

    public Optional<LedgerAccount> findAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE id = ?",
            accountMapper, accountId).stream().findFirst();
    }

    public Optional<LedgerAccount> findAccountByEmployee(UUID employeeId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE employee_id = ? ORDER BY created_at LIMIT 1",
            accountMapper, employeeId).stream().findFirst();
    }

    public Optional<LedgerAccount> findAccount(UUID employeeId, UUID locationId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE employee_id = ? AND location_id = ?",
            accountMapper, employeeId, locationId).stream().findFirst();
    }

    /**
     * Locks the account row until the surrounding transaction ends.
     * Every balance change goes through this lock.
     */
    public Optional<LedgerAccount> lockAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM ledger_accounts WHERE id = ? FOR UPDATE",
            accountMapper, accountId).stream().findFirst();
    }

    // ==================== Entries ====================

    /**
     * Inserts the entry and moves the cached balance by the same amount.
     * The account must already be locked by the caller.
     */
    public LedgerEntry append(PostingRequest request) {
        UUID entryId = UUID.randomUUID();
        Instant now = Instant.now();

        Long sequence = jdbcTemplate.queryForObject("""
            INSERT INTO ledger_entries
                (id, account_id, amount_cents, source_type, source_id, idempotency_key,
                 reverses_entry_id, memo, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING sequence_number
            """,
            Long.class,
            entryId,
            request.getAccountId(),
            request.getAmountCents(),
            request.getSourceType().name(),
            request.getSourceId(),
            request.getIdempotencyKey(),
            request.getReversesEntryId(),
            request.getMemo(),
            JdbcTimestamps.of(now));

        jdbcTemplate.update(
            "UPDATE ledger_accounts SET balance_cents = balance_cents + ?, updated_at = ? WHERE id = ?",
            request.getAmountCents(), JdbcTimestamps.of(now), request.getAccountId());

        return new LedgerEntry(
            entryId,
            request.getAccountId(),
            request.getAmountCents(),
            request.getSourceType(),
            request.getSourceId(),
            request.getIdempotencyKey(),
            request.getReversesEntryId(),
            request.getMemo(),
            now,
            sequence);
    }

    public Optional<LedgerEntry> findEntry(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ?",
            entryMapper, entryId).stream().findFirst();
    }

    public Optional<LedgerEntry> findEntryByKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE idempotency_key = ?",
            entryMapper, idempotencyKey).stream().findFirst();
    }

    public List<LedgerEntry> findEntriesByKeyPrefix(String prefix) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE idempotency_key LIKE ? ORDER BY sequence_number",
            entryMapper, prefix + "%");
    }

    public List<LedgerEntry> findEntriesBySource(EntrySourceType sourceType, UUID sourceId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE source_type = ? AND source_id = ? ORDER BY sequence_number",
            entryMapper, sourceType.name(), sourceId);
    }

    /**
     * One keyset page of an account's entries, ordered by sequence number.
     *
     * @param from inclusive lower bound on created_at, or null
     * @param to exclusive upper bound on created_at, or null
     */
    public List<LedgerEntry> findEntriesPage(UUID accountId, Instant from, Instant to,
                                             long afterSequence, int limit) {
        return jdbcTemplate.query("""
            SELECT %s FROM ledger_entries
            WHERE account_id = ?
              AND sequence_number > ?
              AND (CAST(? AS TIMESTAMPTZ) IS NULL OR created_at >= ?)
              AND (CAST(? AS TIMESTAMPTZ) IS NULL OR created_at < ?)
            ORDER BY sequence_number
            LIMIT ?
            """.formatted(ENTRY_COLUMNS),
            entryMapper,
            accountId, afterSequence,
            JdbcTimestamps.of(from), JdbcTimestamps.of(from),
            JdbcTimestamps.of(to), JdbcTimestamps.of(to),
            limit);
    }

    /**
     * Independent recomputation of the balance from the entries.
     */
    public long sumEntries(UUID accountId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_cents), 0) FROM ledger_entries WHERE account_id = ?",
            Long.class, accountId);
        return sum == null ? 0L : sum;
    }
}
