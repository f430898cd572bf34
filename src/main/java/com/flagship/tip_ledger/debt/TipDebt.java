package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Clawback owed by one employee after a chargeback.
 *
 * {@code remainingCents} only ever decreases. State transitions return new
 * instances:
 * <pre>
 * OPEN -> RECOVERED     (remaining reaches zero through recoveries)
 * OPEN -> WRITTEN_OFF   (manager forgives the rest)
 * </pre>
 */
@Value
public class TipDebt {
    UUID id;
    UUID accountId;
    UUID employeeId;
    UUID tipTransactionId;
    long originalAmountCents;
    long remainingCents;
    DebtStatus status;
    Instant createdAt;
    Instant recoveredAt;
    Instant writtenOffAt;
    String writtenOffBy;
    String writeOffReason;

    public static TipDebt open(UUID accountId, UUID employeeId, UUID tipTransactionId, long amountCents) {
        if (amountCents <= 0) {
            throw TipLedgerException.validation("Debt amount must be positive, got %d", amountCents);
        }
        return new TipDebt(
            UUID.randomUUID(),
            accountId,
            employeeId,
            tipTransactionId,
            amountCents,
            amountCents,
            DebtStatus.OPEN,
            Instant.now(),
            null,
            null,
            null,
            null
        );
    }

    public boolean isOpen() {
        return status == DebtStatus.OPEN;
    }

    public long recoveredCents() {
        return status == DebtStatus.WRITTEN_OFF ? 0L : originalAmountCents - remainingCents;
    }

    /**
     * Applies a recovery of {@code amountCents}, at most the remaining balance.
     */
    public TipDebt recover(long amountCents) {
        requireOpen();
        if (amountCents <= 0 || amountCents > remainingCents) {
            throw TipLedgerException.of(ErrorKind.INTEGRITY_VIOLATION,
                "Recovery of %d cents on debt %s with %d remaining", amountCents, id, remainingCents);
        }
        long remaining = remainingCents - amountCents;
        boolean settled = remaining == 0;
        return new TipDebt(
            id,
            accountId,
            employeeId,
            tipTransactionId,
            originalAmountCents,
            remaining,
            settled ? DebtStatus.RECOVERED : DebtStatus.OPEN,
            createdAt,
            settled ? Instant.now() : null,
            null,
            null,
            null
        );
    }

    public TipDebt writeOff(String reason, String writtenOffBy) {
        requireOpen();
        if (reason == null || reason.isBlank()) {
            throw TipLedgerException.validation("A write-off needs a reason");
        }
        return new TipDebt(
            id,
            accountId,
            employeeId,
            tipTransactionId,
            originalAmountCents,
            0L,
            DebtStatus.WRITTEN_OFF,
            createdAt,
            null,
            Instant.now(),
            writtenOffBy,
            reason
        );
    }

    private void requireOpen() {
        if (status != DebtStatus.OPEN) {
            throw TipLedgerException.of(ErrorKind.ALREADY_RESOLVED,
                "Debt %s is already %s", id, status);
        }
    }
}
