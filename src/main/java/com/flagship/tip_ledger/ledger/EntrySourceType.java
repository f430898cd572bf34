package com.flagship.tip_ledger.ledger;

/**
 * What caused a ledger entry.
 */
public enum EntrySourceType {
    TIP_TRANSACTION,
    TIP_OUT,
    BANK_COLLECTION,
    DEBT_RECOVERY,
    MANUAL_ADJUSTMENT,
    TRANSFER,
    REVERSAL;

    /**
     * Earnings that pay down open chargeback debt when credited.
     */
    public boolean isRecoverable() {
        return this == TIP_TRANSACTION || this == TIP_OUT || this == BANK_COLLECTION;
    }
}
