package com.flagship.tip_ledger.debt;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one credit across open debts, oldest first.
 *
 * Each debt takes {@code min(remaining, creditLeft)}; the total never exceeds
 * the credit, and no debt is taken below zero.
 */
public final class DebtRecoveryPlan {

    private DebtRecoveryPlan() {
    }

    public static List<Recovery> plan(long creditCents, List<TipDebt> openDebtsOldestFirst) {
        List<Recovery> recoveries = new ArrayList<>();
        long left = creditCents;
        for (TipDebt debt : openDebtsOldestFirst) {
            if (left <= 0) {
                break;
            }
            if (!debt.isOpen() || debt.getRemainingCents() == 0) {
                continue;
            }
            long take = Math.min(debt.getRemainingCents(), left);
            recoveries.add(new Recovery(debt, take));
            left -= take;
        }
        return recoveries;
    }

    public record Recovery(TipDebt debt, long amountCents) {
    }
}
