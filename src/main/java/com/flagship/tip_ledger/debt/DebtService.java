package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.event.TipDebtWrittenOffEvent;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Manager-facing debt operations. Recovery itself happens in
 * {@link DebtRecoveryInterceptor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DebtService {

    private final DebtRepository repository;
    private final TransactionRunner transactionRunner;
    private final OutboxService outboxService;
    private final TipMetrics metrics;

    /**
     * Forgives the rest of an open debt.
     *
     * @throws TipLedgerException ALREADY_RESOLVED if the debt is recovered or written off
     */
    public TipDebt writeOff(UUID debtId, String reason, String writtenOffBy) {
        return transactionRunner.inTransaction("debt write-off", () -> {
            TipDebt debt = repository.lock(debtId)
                .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_DEBT, "Debt not found: %s", debtId));

            TipDebt writtenOff = debt.writeOff(reason, writtenOffBy);
            repository.update(writtenOff);
            outboxService.saveEvent("TipDebt", debtId, TipDebtWrittenOffEvent.from(writtenOff, debt.getRemainingCents()));

            log.info("Debt {} written off by {} with {} cents outstanding: {}",
                debtId, writtenOffBy, debt.getRemainingCents(), reason);
            metrics.recordDebtWrittenOff();
            return writtenOff;
        });
    }

    public TipDebt get(UUID debtId) {
        return repository.findById(debtId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_DEBT, "Debt not found: %s", debtId));
    }

    public List<TipDebt> openDebts(UUID employeeId) {
        return repository.findByEmployee(employeeId, true);
    }

    public List<TipDebt> debtsOf(UUID employeeId) {
        return repository.findByEmployee(employeeId, false);
    }

    public List<TipDebt> debtsForTransaction(UUID tipTransactionId) {
        return repository.findByTransaction(tipTransactionId);
    }
}
