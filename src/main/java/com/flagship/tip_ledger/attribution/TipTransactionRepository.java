package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.common.JdbcTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class TipTransactionRepository {

    private static final String COLUMNS = """
        id, payment_id, location_id, kind, tender, gross_amount_cents, card_fee_cents, amount_cents,
        sales_amount_cents, section, collected_at, target_type, employee_id, pool_id, segment_id,
        status, created_at, charged_back_at
        """;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<TipTransaction> mapper = (rs, rowNum) -> TipTransaction.builder()
        .id(rs.getObject("id", UUID.class))
        .paymentId(rs.getString("payment_id"))
        .locationId(rs.getObject("location_id", UUID.class))
        .kind(TipKind.valueOf(rs.getString("kind")))
        .tender(Tender.valueOf(rs.getString("tender")))
        .grossAmountCents(rs.getLong("gross_amount_cents"))
        .cardFeeCents(rs.getLong("card_fee_cents"))
        .amountCents(rs.getLong("amount_cents"))
        .salesAmountCents(rs.getObject("sales_amount_cents", Long.class))
        .section(rs.getString("section"))
        .collectedAt(JdbcTimestamps.read(rs, "collected_at"))
        .targetType(rs.getString("target_type"))
        .employeeId(rs.getObject("employee_id", UUID.class))
        .poolId(rs.getObject("pool_id", UUID.class))
        .segmentId(rs.getObject("segment_id", UUID.class))
        .status(TipTransactionStatus.valueOf(rs.getString("status")))
        .createdAt(JdbcTimestamps.read(rs, "created_at"))
        .chargedBackAt(JdbcTimestamps.read(rs, "charged_back_at"))
        .build();

    /**
     * Fails with {@link org.springframework.dao.DuplicateKeyException} when the
     * payment was already attributed.
     */
    public void insert(TipTransaction transaction) {
        jdbcTemplate.update("""
            INSERT INTO tip_transactions
                (id, payment_id, location_id, kind, tender, gross_amount_cents, card_fee_cents, amount_cents,
                 sales_amount_cents, section, collected_at, target_type, employee_id, pool_id, segment_id,
                 status, created_at, charged_back_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NULL)
            """,
            transaction.getId(), transaction.getPaymentId(), transaction.getLocationId(),
            transaction.getKind().name(), transaction.getTender().name(),
            transaction.getGrossAmountCents(), transaction.getCardFeeCents(), transaction.getAmountCents(),
            transaction.getSalesAmountCents(), transaction.getSection(),
            JdbcTimestamps.of(transaction.getCollectedAt()), transaction.getTargetType(),
            transaction.getEmployeeId(), transaction.getPoolId(), transaction.getSegmentId(),
            transaction.getStatus().name(), JdbcTimestamps.of(transaction.getCreatedAt()));
    }

    public Optional<TipTransaction> findById(UUID id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tip_transactions WHERE id = ?", mapper, id)
            .stream().findFirst();
    }

    public Optional<TipTransaction> findByPaymentId(String paymentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tip_transactions WHERE payment_id = ?",
            mapper, paymentId).stream().findFirst();
    }

    /**
     * Serializes chargeback handling of one payment.
     */
    public Optional<TipTransaction> lockByPaymentId(String paymentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tip_transactions WHERE payment_id = ? FOR UPDATE",
            mapper, paymentId).stream().findFirst();
    }

    public List<TipTransaction> findBySegment(UUID segmentId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM tip_transactions WHERE segment_id = ? ORDER BY collected_at, id",
            mapper, segmentId);
    }

    public boolean markChargedBack(UUID id, Instant chargedBackAt) {
        int rows = jdbcTemplate.update("""
            UPDATE tip_transactions SET status = 'CHARGED_BACK', charged_back_at = ?
            WHERE id = ? AND status = 'POSTED'
            """,
            JdbcTimestamps.of(chargedBackAt), id);
        return rows == 1;
    }
}
