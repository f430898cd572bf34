package com.flagship.tip_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-employee, per-location tip balance. The balance is a cache of the sum of
 * the account's entries and is only ever changed together with an entry insert.
 */
@Value
public class LedgerAccount {
    UUID id;
    UUID employeeId;
    UUID locationId;
    long balanceCents;
    Instant createdAt;
    Instant updatedAt;
}
