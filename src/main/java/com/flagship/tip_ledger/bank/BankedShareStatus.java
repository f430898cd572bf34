package com.flagship.tip_ledger.bank;

public enum BankedShareStatus {
    PENDING,
    COLLECTED,
    PAID_OUT
}
