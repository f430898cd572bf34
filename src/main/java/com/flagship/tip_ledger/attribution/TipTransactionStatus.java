package com.flagship.tip_ledger.attribution;

public enum TipTransactionStatus {
    POSTED,
    CHARGED_BACK
}
