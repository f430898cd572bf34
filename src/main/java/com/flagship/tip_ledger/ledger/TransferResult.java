package com.flagship.tip_ledger.ledger;

import lombok.Value;

import java.util.UUID;

@Value
public class TransferResult {
    UUID transferId;
    LedgerEntry debit;
    LedgerEntry credit;
    boolean duplicate;
}
