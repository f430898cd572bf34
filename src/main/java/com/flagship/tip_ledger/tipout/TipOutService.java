package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.attribution.EmployeeShare;
import com.flagship.tip_ledger.attribution.ShareAllocator;
import com.flagship.tip_ledger.attribution.TipTransaction;
import com.flagship.tip_ledger.bank.BankedShare;
import com.flagship.tip_ledger.bank.BankedShareRepository;
import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.ledger.PostingRequest;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.shift.Employee;
import com.flagship.tip_ledger.shift.ShiftDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies role-to-role tip-outs on top of freshly attributed shares.
 *
 * Runs inside the attribution transaction. Each giver is debited once per rule
 * and the amount is split equally across the target role's employees on duty
 * at the collection instant. When none of them is on duty, the split runs over
 * the whole role and every portion is banked. Every posting key derives from
 * the tip transaction, so a replay is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TipOutService {

    private final TipOutRuleService ruleService;
    private final ShiftDirectory shiftDirectory;
    private final LedgerService ledgerService;
    private final BankedShareRepository bankedShareRepository;
    private final TipMetrics metrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<TipOutApplication> apply(TipTransaction transaction, List<EmployeeShare> shares) {
        List<TipOutApplication> applied = new ArrayList<>();
        for (EmployeeShare share : shares) {
            if (share.getShareCents() <= 0) {
                continue;
            }
            Optional<String> role = shiftDirectory.roleOf(share.getEmployeeId());
            if (role.isEmpty()) {
                continue;
            }
            long remaining = share.getShareCents();
            for (TipOutRule rule : ruleService.applicableRules(transaction.getLocationId(), role.get(),
                    transaction.getCollectedAt())) {
                long salesBasis = TipOutCalculator.salesBasis(transaction.getSalesAmountCents(),
                    share.getShareCents(), transaction.getAmountCents());
                long amount = Math.min(remaining,
                    TipOutCalculator.amountFor(rule, share.getShareCents(), salesBasis));
                if (amount <= 0) {
                    continue;
                }
                TipOutApplication application = applyRule(transaction, share.getEmployeeId(), rule, amount);
                if (application != null) {
                    remaining -= amount;
                    applied.add(application);
                }
            }
        }
        return applied;
    }

    private TipOutApplication applyRule(TipTransaction transaction, UUID giverId, TipOutRule rule, long amountCents) {
        List<UUID> roleMembers = shiftDirectory.recipientsFor(transaction.getLocationId(), rule.getToRole(),
                transaction.getSection()).stream()
            .map(Employee::getId)
            .filter(id -> !id.equals(giverId))
            .toList();
        if (roleMembers.isEmpty()) {
            log.warn("Tip-out rule {} found no {} to receive {} cents from {}; nothing moved",
                rule.getId(), rule.getToRole(), amountCents, giverId);
            return null;
        }
        List<UUID> onDuty = roleMembers.stream()
            .filter(id -> shiftDirectory.isOnDuty(id, rule.getToRole(), transaction.getSection(),
                transaction.getCollectedAt()))
            .toList();
        boolean banking = onDuty.isEmpty();

        ledgerService.post(PostingRequest.builder()
            .accountId(ledgerService.accountOf(giverId).getId())
            .amountCents(-amountCents)
            .sourceType(EntrySourceType.TIP_OUT)
            .sourceId(transaction.getId())
            .idempotencyKey(IdempotencyKeys.tipOutDebit(transaction.getId(), rule.getId(), giverId))
            .memo("Tip-out to " + rule.getToRole())
            .build());

        List<EmployeeShare> credited = new ArrayList<>();
        List<BankedShare> banked = new ArrayList<>();
        for (EmployeeShare portion : ShareAllocator.splitEqually(amountCents, banking ? roleMembers : onDuty)) {
            if (portion.getShareCents() == 0) {
                continue;
            }
            UUID recipientId = portion.getEmployeeId();
            String key = IdempotencyKeys.tipOutCredit(transaction.getId(), rule.getId(), giverId, recipientId);
            if (banking) {
                banked.add(bankedShareRepository.insertIfAbsent(BankedShare.pending(recipientId, rule.getToRole(),
                    transaction.getSection(), giverId, rule.getId(), transaction.getId(),
                    portion.getShareCents(), key)));
                metrics.recordTipOut(true);
                log.info("Banked {} cents for off-duty {} {}", portion.getShareCents(), rule.getToRole(), recipientId);
            } else {
                ledgerService.post(PostingRequest.builder()
                    .accountId(ledgerService.accountOf(recipientId).getId())
                    .amountCents(portion.getShareCents())
                    .sourceType(EntrySourceType.TIP_OUT)
                    .sourceId(transaction.getId())
                    .idempotencyKey(key)
                    .memo("Tip-out from " + giverId)
                    .build());
                credited.add(portion);
                metrics.recordTipOut(false);
            }
        }

        log.info("Tip-out {}: {} gave {} cents to {} ({} credited, {} banked)",
            rule.getId(), giverId, amountCents, rule.getToRole(), credited.size(), banked.size());
        return new TipOutApplication(rule.getId(), giverId, rule.getToRole(), amountCents,
            List.copyOf(credited), List.copyOf(banked));
    }
}
