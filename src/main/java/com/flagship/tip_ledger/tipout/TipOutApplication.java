package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.attribution.EmployeeShare;
import com.flagship.tip_ledger.bank.BankedShare;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * One rule applied to one giver: the debit and where it went.
 */
@Value
public class TipOutApplication {
    UUID ruleId;
    UUID fromEmployeeId;
    String toRole;
    long amountCents;
    List<EmployeeShare> credited;
    List<BankedShare> banked;
}
