package com.flagship.tip_ledger.bank;

import com.flagship.tip_ledger.common.JdbcTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class BankedShareRepository {

    private static final String COLUMNS = """
        id, employee_id, role, section, from_employee_id, rule_id, tip_transaction_id, amount_cents, status,
        idempotency_key, created_at, collected_at, ledger_entry_id, paid_out_at, payroll_ref
        """;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<BankedShare> mapper = (rs, rowNum) -> new BankedShare(
        rs.getObject("id", UUID.class),
        rs.getObject("employee_id", UUID.class),
        rs.getString("role"),
        rs.getString("section"),
        rs.getObject("from_employee_id", UUID.class),
        rs.getObject("rule_id", UUID.class),
        rs.getObject("tip_transaction_id", UUID.class),
        rs.getLong("amount_cents"),
        BankedShareStatus.valueOf(rs.getString("status")),
        rs.getString("idempotency_key"),
        JdbcTimestamps.read(rs, "created_at"),
        JdbcTimestamps.read(rs, "collected_at"),
        rs.getObject("ledger_entry_id", UUID.class),
        JdbcTimestamps.read(rs, "paid_out_at"),
        rs.getString("payroll_ref")
    );

    /**
     * @return the stored share: the new one, or the one already holding the key
     */
    public BankedShare insertIfAbsent(BankedShare share) {
        jdbcTemplate.update("""
            INSERT INTO banked_shares
                (id, employee_id, role, section, from_employee_id, rule_id, tip_transaction_id, amount_cents,
                 status, idempotency_key, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (idempotency_key) DO NOTHING
            """,
            share.getId(), share.getEmployeeId(), share.getRole(), share.getSection(), share.getFromEmployeeId(),
            share.getRuleId(), share.getTipTransactionId(), share.getAmountCents(), share.getStatus().name(),
            share.getIdempotencyKey(), JdbcTimestamps.of(share.getCreatedAt()));
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM banked_shares WHERE idempotency_key = ?",
            mapper, share.getIdempotencyKey()).get(0);
    }

    public void update(BankedShare share) {
        jdbcTemplate.update("""
            UPDATE banked_shares
            SET status = ?, collected_at = ?, ledger_entry_id = ?, paid_out_at = ?, payroll_ref = ?
            WHERE id = ?
            """,
            share.getStatus().name(), JdbcTimestamps.of(share.getCollectedAt()), share.getLedgerEntryId(),
            JdbcTimestamps.of(share.getPaidOutAt()), share.getPayrollRef(), share.getId());
    }

    public Optional<BankedShare> findById(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM banked_shares WHERE id = ?", mapper, id)
            .stream().findFirst();
    }

    public Optional<BankedShare> lock(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM banked_shares WHERE id = ? FOR UPDATE", mapper, id)
            .stream().findFirst();
    }

    public List<BankedShare> findPendingByEmployee(UUID employeeId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM banked_shares WHERE employee_id = ? AND status = 'PENDING' ORDER BY created_at, id",
            mapper, employeeId);
    }

    public List<BankedShare> findByTransaction(UUID tipTransactionId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM banked_shares WHERE tip_transaction_id = ? ORDER BY created_at, id",
            mapper, tipTransactionId);
    }
}
