package com.flagship.tip_ledger.ledger;

import com.flagship.tip_ledger.common.IdOrder;
import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.config.TipLedgerProperties;
import com.flagship.tip_ledger.observability.TipMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, idempotent posting against per-employee accounts.
 *
 * Every post locks the target account row, checks the idempotency key, appends
 * the entry, moves the balance and runs the {@link CreditInterceptor}s, all in
 * one transaction. Concurrent posts to the same account therefore serialize on
 * the row lock while posts to different accounts proceed in parallel.
 */
@Service
@Slf4j
public class LedgerService {

    private final LedgerRepository repository;
    private final TransactionRunner transactionRunner;
    private final List<CreditInterceptor> creditInterceptors;
    private final TipMetrics metrics;
    private final int historyPageSize;

    public LedgerService(LedgerRepository repository,
                         TransactionRunner transactionRunner,
                         List<CreditInterceptor> creditInterceptors,
                         TipMetrics metrics,
                         TipLedgerProperties properties) {
        this.repository = repository;
        this.transactionRunner = transactionRunner;
        this.creditInterceptors = creditInterceptors;
        this.metrics = metrics;
        this.historyPageSize = properties.history().pageSize();
    }

    /**
     * Opens the employee's account at a location, or returns the existing one.
     */
    public LedgerAccount openAccount(UUID employeeId, UUID locationId) {
        return transactionRunner.inTransaction("open account", () -> {
            repository.insertAccountIfAbsent(employeeId, locationId);
            return repository.findAccount(employeeId, locationId)
                .orElseThrow(() -> new TipLedgerException(ErrorKind.INTEGRITY_VIOLATION,
                    "Account for employee " + employeeId + " vanished after insert"));
        });
    }

    /**
     * Posts one entry. A repeated idempotency key returns the first result and
     * writes nothing.
     */
    public PostingResult post(PostingRequest request) {
        try {
            return transactionRunner.inTransaction("ledger post", () -> postLocked(request));
        } catch (DuplicateKeyException e) {
            // lost the insert race on the idempotency key against another account's lock
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                throw e;
            }
            return repository.findEntryByKey(request.getIdempotencyKey())
                .map(this::duplicateOf)
                .orElseThrow(() -> e);
        }
    }

    private PostingResult postLocked(PostingRequest request) {
        LedgerAccount account = repository.lockAccount(request.getAccountId())
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_ACCOUNT,
                "Account not found: %s", request.getAccountId()));

        Optional<LedgerEntry> existing = repository.findEntryByKey(request.getIdempotencyKey());
        if (existing.isPresent()) {
            LedgerEntry entry = existing.get();
            if (!entry.getAccountId().equals(request.getAccountId())
                    || entry.getAmountCents() != request.getAmountCents()) {
                log.warn("Idempotency key {} reused with different content; returning the original entry {}",
                    request.getIdempotencyKey(), entry.getId());
            }
            log.debug("Duplicate post ignored: key={}", request.getIdempotencyKey());
            metrics.recordDuplicatePost();
            return duplicateOf(entry);
        }

        LedgerEntry entry = repository.append(request);
        log.info("Posted {} cents to account {} (source={} {}, key={})",
            entry.getAmountCents(), account.getId(), entry.getSourceType(), entry.getSourceId(),
            entry.getIdempotencyKey());
        metrics.recordPosting(entry.getSourceType(), entry.getAmountCents());

        List<LedgerEntry> recoveries = new ArrayList<>();
        if (entry.isCredit() && entry.getSourceType().isRecoverable()) {
            for (CreditInterceptor interceptor : creditInterceptors) {
                recoveries.addAll(interceptor.afterCredit(account, entry));
            }
        }
        return PostingResult.posted(entry, recoveries);
    }

    private PostingResult duplicateOf(LedgerEntry entry) {
        return PostingResult.duplicate(entry, recoveriesFor(entry.getId()));
    }

    /**
     * Posts the negated amount of an entry as a {@code REVERSAL}. The original
     * is never touched. Reversing twice returns the first reversal.
     */
    public PostingResult reverse(UUID entryId, String memo) {
        LedgerEntry original = findEntry(entryId);
        return reversePartially(original, Math.abs(original.getAmountCents()), memo);
    }

    /**
     * Reverses {@code amountCents} of an entry, at most its full amount.
     */
    public PostingResult reversePartially(LedgerEntry original, long amountCents, String memo) {
        if (original.isReversal()) {
            throw TipLedgerException.validation("Entry %s is itself a reversal", original.getId());
        }
        if (amountCents <= 0 || amountCents > Math.abs(original.getAmountCents())) {
            throw TipLedgerException.validation("Reversal of %d cents is outside (0, %d]",
                amountCents, Math.abs(original.getAmountCents()));
        }
        long signed = original.getAmountCents() > 0 ? -amountCents : amountCents;

        return post(PostingRequest.builder()
            .accountId(original.getAccountId())
            .amountCents(signed)
            .sourceType(EntrySourceType.REVERSAL)
            .sourceId(original.getSourceId())
            .idempotencyKey(IdempotencyKeys.reversal(original.getId()))
            .reversesEntryId(original.getId())
            .memo(memo)
            .build());
    }

    /**
     * Manager correction on an employee's balance.
     */
    public PostingResult adjust(UUID employeeId, long amountCents, String memo, String idempotencyKey) {
        LedgerAccount account = accountOf(employeeId);
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw TipLedgerException.validation("Idempotency key cannot be null or blank");
        }
        String key = IdempotencyKeys.adjustment(idempotencyKey);
        return post(PostingRequest.builder()
            .accountId(account.getId())
            .amountCents(amountCents)
            .sourceType(EntrySourceType.MANUAL_ADJUSTMENT)
            .sourceId(IdempotencyKeys.nameBased(key))
            .idempotencyKey(key)
            .memo(memo)
            .build());
    }

    /**
     * Moves tips from one employee to another as a debit/credit pair.
     * Both accounts are locked in id order so opposite transfers cannot deadlock.
     */
    public TransferResult transfer(UUID fromEmployeeId, UUID toEmployeeId, long amountCents,
                                   String memo, String idempotencyKey) {
        if (fromEmployeeId == null || toEmployeeId == null) {
            throw TipLedgerException.validation("Both employees are required");
        }
        if (fromEmployeeId.equals(toEmployeeId)) {
            throw TipLedgerException.validation("Cannot transfer tips to yourself");
        }
        if (amountCents <= 0) {
            throw TipLedgerException.validation("Transfer amount must be positive, got %d", amountCents);
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw TipLedgerException.validation("Idempotency key cannot be null or blank");
        }
        LedgerAccount from = accountOf(fromEmployeeId);
        LedgerAccount to = accountOf(toEmployeeId);
        UUID transferId = IdempotencyKeys.nameBased("transfer:" + idempotencyKey);

        return transactionRunner.inTransaction("tip transfer", () -> {
            UUID first = IdOrder.ASCENDING.compare(from.getId(), to.getId()) < 0 ? from.getId() : to.getId();
            UUID second = first.equals(from.getId()) ? to.getId() : from.getId();
            repository.lockAccount(first);
            repository.lockAccount(second);

            PostingResult debit = post(PostingRequest.builder()
                .accountId(from.getId())
                .amountCents(-amountCents)
                .sourceType(EntrySourceType.TRANSFER)
                .sourceId(transferId)
                .idempotencyKey(IdempotencyKeys.transferDebit(idempotencyKey))
                .memo(memo)
                .build());
            PostingResult credit = post(PostingRequest.builder()
                .accountId(to.getId())
                .amountCents(amountCents)
                .sourceType(EntrySourceType.TRANSFER)
                .sourceId(transferId)
                .idempotencyKey(IdempotencyKeys.transferCredit(idempotencyKey))
                .memo(memo)
                .build());
            return new TransferResult(transferId, debit.getEntry(), credit.getEntry(), debit.isDuplicate());
        });
    }

    /**
     * Locks the account row for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerAccount lockAccount(UUID accountId) {
        return repository.lockAccount(accountId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_ACCOUNT, "Account not found: %s", accountId));
    }

    // ==================== Reads ====================

    public long balance(UUID employeeId) {
        return accountOf(employeeId).getBalanceCents();
    }

    public LedgerAccount accountOf(UUID employeeId) {
        return repository.findAccountByEmployee(employeeId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_ACCOUNT,
                "No ledger account for employee %s", employeeId));
    }

    public LedgerAccount getAccount(UUID accountId) {
        return repository.findAccount(accountId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_ACCOUNT, "Account not found: %s", accountId));
    }

    public LedgerEntry findEntry(UUID entryId) {
        return repository.findEntry(entryId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_ENTRY, "Ledger entry not found: %s", entryId));
    }

    /**
     * Debt recovery entries that were posted against {@code creditEntryId}.
     */
    public List<LedgerEntry> recoveriesFor(UUID creditEntryId) {
        return repository.findEntriesByKeyPrefix(IdempotencyKeys.debtRecoveryPrefix(creditEntryId));
    }

    public List<LedgerEntry> entriesForSource(EntrySourceType sourceType, UUID sourceId) {
        return repository.findEntriesBySource(sourceType, sourceId);
    }

    /**
     * Lazy, restartable statement of an employee's entries in {@code [from, to)}.
     * Either bound may be null.
     */
    public LedgerHistory history(UUID employeeId, Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw TipLedgerException.validation("History range start %s must be before end %s", from, to);
        }
        return new LedgerHistory(repository, accountOf(employeeId).getId(), from, to, historyPageSize);
    }

    public long recomputeBalance(UUID accountId) {
        return repository.sumEntries(accountId);
    }

    /**
     * Fails with INTEGRITY_VIOLATION when the cached balance drifted from the
     * sum of the entries.
     */
    public long verifyBalance(UUID accountId) {
        LedgerAccount account = getAccount(accountId);
        long recomputed = repository.sumEntries(accountId);
        if (recomputed != account.getBalanceCents()) {
            log.error("Balance drift on account {}: cached={}, entries={}",
                accountId, account.getBalanceCents(), recomputed);
            throw TipLedgerException.of(ErrorKind.INTEGRITY_VIOLATION,
                "Account %s balance %d does not match entry sum %d", accountId, account.getBalanceCents(), recomputed);
        }
        return recomputed;
    }
}
