package com.flagship.tip_ledger.bank;

import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.event.BankedShareCollectedEvent;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.ledger.PostingRequest;
import com.flagship.tip_ledger.ledger.PostingResult;
import com.flagship.tip_ledger.observability.CorrelationContext;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import com.flagship.tip_ledger.shift.ShiftDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Holds tip-outs for off-duty recipients until they are collected into the
 * ledger or settled through payroll.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankService {

    private static final String AGGREGATE_TYPE = "BankedShare";

    private final BankedShareRepository repository;
    private final LedgerService ledgerService;
    private final ShiftDirectory shiftDirectory;
    private final TransactionRunner transactionRunner;
    private final OutboxService outboxService;
    private final TipMetrics metrics;

    /**
     * Moves a pending share into its owner's ledger. Collecting an already
     * collected share returns it unchanged.
     *
     * @throws TipLedgerException NOT_ON_DUTY if the owner is not clocked in at {@code at};
     *         ALREADY_SETTLED if the share was paid out
     */
    public BankedShare collect(UUID bankedShareId, Instant at) {
        if (at == null) {
            throw TipLedgerException.validation("Collection time is required");
        }
        return transactionRunner.inTransaction("collect banked share", () -> {
            BankedShare share = lockShare(bankedShareId);
            try (MDC.MDCCloseable ignored = CorrelationContext.scoped(
                    CorrelationContext.EMPLOYEE_ID_MDC_KEY, share.getEmployeeId())) {
                if (share.getStatus() == BankedShareStatus.COLLECTED) {
                    log.debug("Banked share {} already collected", bankedShareId);
                    return share;
                }
                if (!share.isPending()) {
                    throw TipLedgerException.of(ErrorKind.ALREADY_SETTLED,
                        "Banked share %s was already %s", bankedShareId, share.getStatus());
                }
                if (!shiftDirectory.isOnDuty(share.getEmployeeId(), share.getRole(), share.getSection(), at)) {
                    log.warn("Declined collection of banked share {}: employee {} not on duty as {} at {}",
                        bankedShareId, share.getEmployeeId(), share.getRole(), at);
                    throw TipLedgerException.of(ErrorKind.NOT_ON_DUTY,
                        "Employee %s is not on duty as %s", share.getEmployeeId(), share.getRole());
                }

                PostingResult posted = ledgerService.post(PostingRequest.builder()
                    .accountId(ledgerService.accountOf(share.getEmployeeId()).getId())
                    .amountCents(share.getAmountCents())
                    .sourceType(EntrySourceType.BANK_COLLECTION)
                    .sourceId(share.getId())
                    .idempotencyKey(IdempotencyKeys.bankCollection(share.getId()))
                    .memo("Banked tip-out from " + share.getFromEmployeeId())
                    .build());

                BankedShare collected = share.collect(at, posted.getEntry().getId());
                repository.update(collected);
                outboxService.saveEvent(AGGREGATE_TYPE, collected.getId(), BankedShareCollectedEvent.from(collected));
                metrics.recordBankedShareCollected();

                log.info("Collected banked share {}: {} cents into entry {}",
                    bankedShareId, collected.getAmountCents(), posted.getEntry().getId());
                return collected;
            }
        });
    }

    /**
     * Settles a pending share outside the ledger. Repeating the call with the
     * same payroll reference returns the settled share.
     *
     * @throws TipLedgerException ALREADY_SETTLED if the share was collected or paid
     *         out under another reference
     */
    public BankedShare payOut(UUID bankedShareId, String payrollRef) {
        if (payrollRef == null || payrollRef.isBlank()) {
            throw TipLedgerException.validation("Payroll reference is required");
        }
        return transactionRunner.inTransaction("pay out banked share", () -> {
            BankedShare share = lockShare(bankedShareId);
            if (share.getStatus() == BankedShareStatus.PAID_OUT && payrollRef.equals(share.getPayrollRef())) {
                log.debug("Banked share {} already paid out under {}", bankedShareId, payrollRef);
                return share;
            }
            BankedShare paid = share.payOut(Instant.now(), payrollRef);
            repository.update(paid);
            log.info("Banked share {} of {} cents paid out via payroll {}", bankedShareId, paid.getAmountCents(), payrollRef);
            return paid;
        });
    }

    public List<BankedShare> pendingBankedShares(UUID employeeId) {
        return repository.findPendingByEmployee(employeeId);
    }

    public BankedShare get(UUID bankedShareId) {
        return repository.findById(bankedShareId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_BANKED_SHARE,
                "Banked share not found: %s", bankedShareId));
    }

    private BankedShare lockShare(UUID bankedShareId) {
        return repository.lock(bankedShareId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_BANKED_SHARE,
                "Banked share not found: %s", bankedShareId));
    }
}
