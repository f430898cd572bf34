package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.attribution.TipTransaction;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

@Value
public class ChargebackResult {
    TipTransaction transaction;
    ChargebackPolicy policy;
    List<LedgerEntry> reversals;
    List<TipDebt> debts;
    boolean duplicate;

    public long reversedCents() {
        return -reversals.stream().mapToLong(LedgerEntry::getAmountCents).sum();
    }

    public long debtCents() {
        return debts.stream().mapToLong(TipDebt::getOriginalAmountCents).sum();
    }
}
