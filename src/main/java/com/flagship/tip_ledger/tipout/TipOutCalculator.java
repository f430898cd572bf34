package com.flagship.tip_ledger.tipout;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tip-out arithmetic. All results are whole cents, rounded down.
 */
public final class TipOutCalculator {

    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private TipOutCalculator() {
    }

    /**
     * Cents the giver owes under {@code rule}.
     *
     * @param shareCents the giver's attributed tip share
     * @param salesBasisCents the giver's part of the sales; only read for SALES rules
     * @return {@code floor(percentage% * basis)}, capped at {@code maxPercentage%}
     *         of the share and never above the share itself
     */
    public static long amountFor(TipOutRule rule, long shareCents, long salesBasisCents) {
        if (shareCents <= 0) {
            return 0;
        }
        long basis = rule.getBasisType() == BasisType.SALES ? salesBasisCents : shareCents;
        long amount = percentOf(rule.getPercentage(), basis);
        if (rule.getMaxPercentage() != null) {
            amount = Math.min(amount, percentOf(rule.getMaxPercentage(), shareCents));
        }
        return Math.max(0, Math.min(amount, shareCents));
    }

    /**
     * The giver's proportional part of a check's sales: {@code floor(sales * share / total)}.
     */
    public static long salesBasis(Long salesAmountCents, long shareCents, long totalCents) {
        if (salesAmountCents == null || salesAmountCents <= 0 || totalCents <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(salesAmountCents)
            .multiply(BigDecimal.valueOf(shareCents))
            .divide(BigDecimal.valueOf(totalCents), 0, RoundingMode.FLOOR)
            .longValueExact();
    }

    static long percentOf(BigDecimal percentage, long cents) {
        return percentage.multiply(BigDecimal.valueOf(cents))
            .divide(HUNDRED, 0, RoundingMode.FLOOR)
            .longValueExact();
    }
}
