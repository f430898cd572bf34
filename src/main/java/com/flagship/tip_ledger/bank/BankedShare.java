package com.flagship.tip_ledger.bank;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A tip-out owed to an employee who was off duty when it was computed.
 *
 * Settled exactly once: either collected into the ledger by its owner or paid
 * out through payroll.
 */
@Value
public class BankedShare {
    UUID id;
    UUID employeeId;
    String role;
    String section;
    UUID fromEmployeeId;
    UUID ruleId;
    UUID tipTransactionId;
    long amountCents;
    BankedShareStatus status;
    String idempotencyKey;
    Instant createdAt;
    Instant collectedAt;
    UUID ledgerEntryId;
    Instant paidOutAt;
    String payrollRef;

    public static BankedShare pending(UUID employeeId, String role, String section, UUID fromEmployeeId,
                                      UUID ruleId, UUID tipTransactionId, long amountCents, String idempotencyKey) {
        if (amountCents <= 0) {
            throw new IllegalArgumentException("Banked share must be positive, got " + amountCents);
        }
        return new BankedShare(UUID.randomUUID(), employeeId, role, section, fromEmployeeId, ruleId,
            tipTransactionId, amountCents, BankedShareStatus.PENDING, idempotencyKey, Instant.now(),
            null, null, null, null);
    }

    public boolean isPending() {
        return status == BankedShareStatus.PENDING;
    }

    public BankedShare collect(Instant at, UUID entryId) {
        requirePending("collect");
        return new BankedShare(id, employeeId, role, section, fromEmployeeId, ruleId, tipTransactionId,
            amountCents, BankedShareStatus.COLLECTED, idempotencyKey, createdAt, at, entryId, null, null);
    }

    public BankedShare payOut(Instant at, String reference) {
        requirePending("pay out");
        return new BankedShare(id, employeeId, role, section, fromEmployeeId, ruleId, tipTransactionId,
            amountCents, BankedShareStatus.PAID_OUT, idempotencyKey, createdAt, null, null, at, reference);
    }

    private void requirePending(String action) {
        if (!isPending()) {
            throw TipLedgerException.of(ErrorKind.ALREADY_SETTLED,
                "Cannot %s banked share %s: already %s", action, id, status);
        }
    }
}
