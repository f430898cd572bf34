package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.ledger.CreditInterceptor;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerAccount;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.ledger.LedgerRepository;
import com.flagship.tip_ledger.ledger.PostingRequest;
import com.flagship.tip_ledger.observability.TipMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Diverts part of every new earning to the employee's open chargeback debts.
 *
 * Runs while the account row is locked by the credit's transaction, and locks
 * the open debts too, so two concurrent credits cannot both see the same
 * {@code remainingCents}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebtRecoveryInterceptor implements CreditInterceptor {

    private final DebtRepository debtRepository;
    private final LedgerRepository ledgerRepository;
    private final TipMetrics metrics;

    @Override
    public List<LedgerEntry> afterCredit(LedgerAccount lockedAccount, LedgerEntry credit) {
        List<TipDebt> openDebts = debtRepository.lockOpenDebts(lockedAccount.getId());
        if (openDebts.isEmpty()) {
            return List.of();
        }

        List<LedgerEntry> recoveries = new ArrayList<>();
        for (DebtRecoveryPlan.Recovery recovery : DebtRecoveryPlan.plan(credit.getAmountCents(), openDebts)) {
            TipDebt debt = recovery.debt();
            TipDebt updated = debt.recover(recovery.amountCents());

            LedgerEntry entry = ledgerRepository.append(PostingRequest.builder()
                .accountId(lockedAccount.getId())
                .amountCents(-recovery.amountCents())
                .sourceType(EntrySourceType.DEBT_RECOVERY)
                .sourceId(debt.getId())
                .idempotencyKey(IdempotencyKeys.debtRecovery(credit.getId(), debt.getId()))
                .memo("Recovered from " + credit.getSourceType() + " credit " + credit.getId())
                .build());
            debtRepository.update(updated);
            recoveries.add(entry);

            log.info("Recovered {} cents of debt {} from credit {}; {} cents remaining ({})",
                recovery.amountCents(), debt.getId(), credit.getId(), updated.getRemainingCents(), updated.getStatus());
            metrics.recordDebtRecovered(recovery.amountCents(), updated.getStatus() == DebtStatus.RECOVERED);
        }
        return recoveries;
    }
}
