package com.flagship.tip_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a post. {@code duplicate} is true when the idempotency key had
 * already been used and nothing was written.
 */
@Value
public class PostingResult {
    LedgerEntry entry;
    boolean duplicate;
    List<LedgerEntry> recoveries;

    public static PostingResult posted(LedgerEntry entry, List<LedgerEntry> recoveries) {
        return new PostingResult(entry, false, List.copyOf(recoveries));
    }

    public static PostingResult duplicate(LedgerEntry entry, List<LedgerEntry> recoveries) {
        return new PostingResult(entry, true, List.copyOf(recoveries));
    }

    /**
     * Credit minus whatever was diverted to debt recovery.
     */
    public long netAmountCents() {
        return entry.getAmountCents() + recoveries.stream().mapToLong(LedgerEntry::getAmountCents).sum();
    }
}
