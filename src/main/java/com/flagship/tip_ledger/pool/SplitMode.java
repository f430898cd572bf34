package com.flagship.tip_ledger.pool;

public enum SplitMode {
    /** Every live member gets 1/n. */
    EQUAL,
    /** Proportional to the weight each member supplied at join time. */
    WEIGHTED
}
