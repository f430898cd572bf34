package com.flagship.tip_ledger.debt;

/**
 * Who carries the cost of a confirmed card dispute on a tip.
 */
public enum ChargebackPolicy {
    /** Reverse every credit in full and open a debt recovered from future credits. */
    REVERSE_AND_RECOVER,
    /** Reverse what the current balance covers; only the uncovered rest becomes debt. */
    REVERSE_WITHIN_BALANCE,
    /** Record the chargeback; employees keep the tip. */
    BUSINESS_ABSORBS
}
