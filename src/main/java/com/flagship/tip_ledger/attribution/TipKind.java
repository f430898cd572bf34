package com.flagship.tip_ledger.attribution;

public enum TipKind {
    TIP,
    SERVICE_CHARGE,
    AUTO_GRATUITY
}
