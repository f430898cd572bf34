package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.tipout.TipOutApplication;
import lombok.Value;

import java.util.List;

/**
 * What one {@code attributeAndPost} call produced. {@code duplicate} is true
 * when the payment had already been attributed and nothing new was written.
 */
@Value
public class AttributionResult {
    TipTransaction transaction;
    List<EmployeeShare> shares;
    List<LedgerEntry> credits;
    List<LedgerEntry> debtRecoveries;
    List<TipOutApplication> tipOuts;
    boolean duplicate;
}
