package com.flagship.tip_ledger.debt;

public enum DebtStatus {
    OPEN,
    RECOVERED,
    WRITTEN_OFF
}
