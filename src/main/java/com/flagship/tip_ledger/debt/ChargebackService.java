package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.attribution.TipTransaction;
import com.flagship.tip_ledger.attribution.TipTransactionRepository;
import com.flagship.tip_ledger.attribution.TipTransactionStatus;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.config.TipLedgerProperties;
import com.flagship.tip_ledger.event.TipChargedBackEvent;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerAccount;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.observability.CorrelationContext;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Charges a confirmed card dispute back to the employees its tip was credited to.
 *
 * Only the transaction's own credits are reversed; tip-outs paid from them
 * stay where they went. The transaction row is locked first, so a replayed
 * webhook waits for the first one and then finds it charged back.
 */
@Service
@Slf4j
public class ChargebackService {

    private static final String AGGREGATE_TYPE = "TipTransaction";

    private final TipTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final DebtRepository debtRepository;
    private final OutboxService outboxService;
    private final TransactionRunner transactionRunner;
    private final TipMetrics metrics;
    private final ChargebackPolicy policy;

    public ChargebackService(TipTransactionRepository transactionRepository,
                             LedgerService ledgerService,
                             DebtRepository debtRepository,
                             OutboxService outboxService,
                             TransactionRunner transactionRunner,
                             TipMetrics metrics,
                             TipLedgerProperties properties) {
        this.transactionRepository = transactionRepository;
        this.ledgerService = ledgerService;
        this.debtRepository = debtRepository;
        this.outboxService = outboxService;
        this.transactionRunner = transactionRunner;
        this.metrics = metrics;
        this.policy = properties.chargeback().policy();
    }

    public ChargebackResult onChargeback(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            throw TipLedgerException.validation("Payment id is required");
        }
        try (MDC.MDCCloseable ignored = CorrelationContext.scoped(CorrelationContext.PAYMENT_ID_MDC_KEY, paymentId)) {
            return transactionRunner.inTransaction("chargeback", () -> chargeBackLocked(paymentId));
        }
    }

    private ChargebackResult chargeBackLocked(String paymentId) {
        TipTransaction transaction = transactionRepository.lockByPaymentId(paymentId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_TIP_TRANSACTION,
                "No tip transaction for payment %s", paymentId));

        List<LedgerEntry> credits = ledgerService.entriesForSource(EntrySourceType.TIP_TRANSACTION, transaction.getId());
        if (transaction.isChargedBack()) {
            log.debug("Tip transaction {} was already charged back at {}", transaction.getId(), transaction.getChargedBackAt());
            return new ChargebackResult(transaction, policy, existingReversals(transaction),
                debtRepository.findByTransaction(transaction.getId()), true);
        }

        List<LedgerEntry> reversals = new ArrayList<>();
        String memo = "Chargeback of payment " + paymentId;

        for (LedgerEntry credit : credits) {
            LedgerAccount account = ledgerService.lockAccount(credit.getAccountId());
            long reverse;
            long owe;
            switch (policy) {
                case REVERSE_AND_RECOVER -> {
                    reverse = credit.getAmountCents();
                    owe = credit.getAmountCents();
                }
                case REVERSE_WITHIN_BALANCE -> {
                    reverse = Math.min(credit.getAmountCents(), Math.max(0, account.getBalanceCents()));
                    owe = credit.getAmountCents() - reverse;
                }
                default -> {
                    reverse = 0;
                    owe = 0;
                }
            }

            if (reverse > 0) {
                reversals.add(ledgerService.reversePartially(credit, reverse, memo).getEntry());
            }
            if (owe > 0) {
                debtRepository.insertIfAbsent(
                    TipDebt.open(account.getId(), account.getEmployeeId(), transaction.getId(), owe));
            }
            log.info("Chargeback of payment {} on employee {}: reversed {} cents, debt of {} cents ({})",
                paymentId, account.getEmployeeId(), reverse, owe, policy);
        }

        Instant now = Instant.now();
        if (!transactionRepository.markChargedBack(transaction.getId(), now)) {
            throw TipLedgerException.of(ErrorKind.INTEGRITY_VIOLATION,
                "Tip transaction %s changed status while locked", transaction.getId());
        }
        TipTransaction chargedBack = transaction.withStatus(TipTransactionStatus.CHARGED_BACK).withChargedBackAt(now);
        ChargebackResult result = new ChargebackResult(chargedBack, policy, List.copyOf(reversals),
            debtRepository.findByTransaction(transaction.getId()), false);

        outboxService.saveEvent(AGGREGATE_TYPE, transaction.getId(),
            TipChargedBackEvent.from(chargedBack, policy, result.reversedCents(), result.debtCents()));
        metrics.recordChargeback(policy.name());
        return result;
    }

    private List<LedgerEntry> existingReversals(TipTransaction transaction) {
        return ledgerService.entriesForSource(EntrySourceType.REVERSAL, transaction.getId()).stream()
            .filter(entry -> entry.getReversesEntryId() != null)
            .filter(entry -> ledgerService.findEntry(entry.getReversesEntryId()).getSourceType()
                == EntrySourceType.TIP_TRANSACTION)
            .toList();
    }

    public Optional<TipTransaction> findTransaction(String paymentId) {
        return transactionRepository.findByPaymentId(paymentId);
    }
}
