package com.flagship.tip_ledger.debt;

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
public class DebtRepository {

    private static final String COLUMNS = """
        id, account_id, employee_id, tip_transaction_id, original_amount_cents, remaining_cents,
        status, created_at, recovered_at, written_off_at, written_off_by, write_off_reason
        """;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<TipDebt> mapper = (rs, rowNum) -> new TipDebt(
        rs.getObject("id", UUID.class),
        rs.getObject("account_id", UUID.class),
        rs.getObject("employee_id", UUID.class),
        rs.getObject("tip_transaction_id", UUID.class),
        rs.getLong("original_amount_cents"),
        rs.getLong("remaining_cents"),
        DebtStatus.valueOf(rs.getString("status")),
        JdbcTimestamps.read(rs, "created_at"),
        JdbcTimestamps.read(rs, "recovered_at"),
        JdbcTimestamps.read(rs, "written_off_at"),
        rs.getString("written_off_by"),
        rs.getString("write_off_reason")
    );

    /**
     * @return false when a debt for the same transaction and employee already exists
     */
    public boolean insertIfAbsent(TipDebt debt) {
        int rows = jdbcTemplate.update("""
            INSERT INTO tip_debts
                (id, account_id, employee_id, tip_transaction_id, original_amount_cents, remaining_cents,
                 status, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (tip_transaction_id, employee_id) DO NOTHING
            """,
            debt.getId(),
            debt.getAccountId(),
            debt.getEmployeeId(),
            debt.getTipTransactionId(),
            debt.getOriginalAmountCents(),
            debt.getRemainingCents(),
            debt.getStatus().name(),
            JdbcTimestamps.of(debt.getCreatedAt()));
        return rows == 1;
    }

    public void update(TipDebt debt) {
        jdbcTemplate.update("""
            UPDATE tip_debts
            SET remaining_cents = ?, status = ?, recovered_at = ?, written_off_at = ?,
                written_off_by = ?, write_off_reason = ?
            WHERE id = ?
            """,
            debt.getRemainingCents(),
            debt.getStatus().name(),
            JdbcTimestamps.of(debt.getRecoveredAt()),
            JdbcTimestamps.of(debt.getWrittenOffAt()),
            debt.getWrittenOffBy(),
            debt.getWriteOffReason(),
            debt.getId());
    }

    public Optional<TipDebt> findById(UUID debtId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tip_debts WHERE id = ?", mapper, debtId)
            .stream().findFirst();
    }

    public Optional<TipDebt> lock(UUID debtId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tip_debts WHERE id = ? FOR UPDATE", mapper, debtId)
            .stream().findFirst();
    }

    /**
     * Locks the account's open debts, oldest first.
     */
    public List<TipDebt> lockOpenDebts(UUID accountId) {
        return jdbcTemplate.query("""
            SELECT %s FROM tip_debts
            WHERE account_id = ? AND status = 'OPEN'
            ORDER BY created_at, id
            FOR UPDATE
            """.formatted(COLUMNS), mapper, accountId);
    }

    public List<TipDebt> findByEmployee(UUID employeeId, boolean openOnly) {
        String sql = "SELECT " + COLUMNS + " FROM tip_debts WHERE employee_id = ?"
            + (openOnly ? " AND status = 'OPEN'" : "")
            + " ORDER BY created_at, id";
        return jdbcTemplate.query(sql, mapper, employeeId);
    }

    public List<TipDebt> findByTransaction(UUID tipTransactionId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM tip_debts WHERE tip_transaction_id = ? ORDER BY employee_id",
            mapper, tipTransactionId);
    }
}
