package com.flagship.tip_ledger.ledger;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Lazy statement of one account's entries over {@code [from, to)}.
 *
 * Pages are fetched on demand, keyed by sequence number. Each call to
 * {@link #iterator()} starts again from the first entry of the range.
 */
public class LedgerHistory implements Iterable<LedgerEntry> {

    private final LedgerRepository repository;
    private final UUID accountId;
    private final Instant from;
    private final Instant to;
    private final int pageSize;

    LedgerHistory(LedgerRepository repository, UUID accountId, Instant from, Instant to, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.repository = repository;
        this.accountId = accountId;
        this.from = from;
        this.to = to;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<LedgerEntry> iterator() {
        return new PageIterator();
    }

    private final class PageIterator implements Iterator<LedgerEntry> {

        private final Deque<LedgerEntry> buffer = new ArrayDeque<>();
        private long lastSequence = 0L;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<LedgerEntry> page = repository.findEntriesPage(accountId, from, to, lastSequence, pageSize);
                buffer.addAll(page);
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                if (!page.isEmpty()) {
                    lastSequence = page.get(page.size() - 1).getSequenceNumber();
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public LedgerEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.removeFirst();
        }
    }
}
