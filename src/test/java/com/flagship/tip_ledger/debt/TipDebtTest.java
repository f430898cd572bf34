package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Debt state transitions and the oldest-first recovery plan.
 */
class TipDebtTest {

    private static TipDebt debt(long cents) {
        return TipDebt.open(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), cents);
    }

    @Test
    @DisplayName("Partial recoveries reduce the remainder until the debt is recovered")
    void testRecoverUntilSettled() {
        TipDebt debt = debt(500);

        TipDebt partial = debt.recover(200);
        assertEquals(300, partial.getRemainingCents());
        assertEquals(DebtStatus.OPEN, partial.getStatus());
        assertEquals(200, partial.recoveredCents());

        TipDebt settled = partial.recover(300);
        assertEquals(0, settled.getRemainingCents());
        assertEquals(DebtStatus.RECOVERED, settled.getStatus());
        assertNotNull(settled.getRecoveredAt());
    }

    @Test
    @DisplayName("Recovering more than remains is an integrity violation")
    void testOverRecoveryRejected() {
        TipLedgerException e = assertThrows(TipLedgerException.class, () -> debt(100).recover(101));
        assertEquals(ErrorKind.INTEGRITY_VIOLATION, e.getKind());
    }

    @Test
    @DisplayName("Write-off needs a reason and settles the debt once")
    void testWriteOff() {
        TipDebt writtenOff = debt(400).writeOff("Manager forgave", "manager-1");

        assertEquals(DebtStatus.WRITTEN_OFF, writtenOff.getStatus());
        assertEquals(0, writtenOff.getRemainingCents());
        assertEquals(0, writtenOff.recoveredCents());
        assertEquals("manager-1", writtenOff.getWrittenOffBy());

        assertThrows(TipLedgerException.class, () -> debt(400).writeOff(" ", "manager-1"));
        TipLedgerException again = assertThrows(TipLedgerException.class,
            () -> writtenOff.writeOff("again", "manager-1"));
        assertEquals(ErrorKind.ALREADY_RESOLVED, again.getKind());
    }

    @Test
    @DisplayName("Debts must be positive")
    void testNonPositiveDebtRejected() {
        assertThrows(TipLedgerException.class, () -> debt(0));
    }

    @Test
    @DisplayName("A credit pays the oldest debts first and never more than it holds")
    void testRecoveryPlanOldestFirst() {
        TipDebt older = debt(300);
        TipDebt newer = debt(400);

        List<DebtRecoveryPlan.Recovery> plan = DebtRecoveryPlan.plan(500, List.of(older, newer));

        assertEquals(2, plan.size());
        assertEquals(older, plan.get(0).debt());
        assertEquals(300, plan.get(0).amountCents());
        assertEquals(newer, plan.get(1).debt());
        assertEquals(200, plan.get(1).amountCents());
    }

    @Test
    @DisplayName("A credit smaller than the first debt is taken whole")
    void testRecoveryPlanSmallCredit() {
        List<DebtRecoveryPlan.Recovery> plan = DebtRecoveryPlan.plan(50, List.of(debt(300), debt(400)));

        assertEquals(1, plan.size());
        assertEquals(50, plan.get(0).amountCents());
        assertTrue(DebtRecoveryPlan.plan(50, List.of()).isEmpty());
    }
}
