package com.flagship.tip_ledger.attribution;

public enum Tender {
    CARD,
    CASH;

    /**
     * Only card tips can be disputed or carry a processing fee.
     */
    public boolean isCard() {
        return this == CARD;
    }
}
