package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.shift.Roles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Administrative CRUD on tip-out rules. Rules are deactivated, never deleted,
 * because banked shares reference them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TipOutRuleService {

    private final TipOutRuleRepository repository;
    private final TransactionRunner transactionRunner;

    public TipOutRule create(UUID locationId, String fromRole, String toRole, BigDecimal percentage,
                             BigDecimal maxPercentage, BasisType basisType, Instant effectiveFrom, Instant expiresAt) {
        TipOutRule rule = TipOutRule.define(locationId, fromRole, toRole, percentage, maxPercentage, basisType,
            effectiveFrom, expiresAt);
        return transactionRunner.inTransaction("create tip-out rule", () -> {
            repository.save(TipOutRuleEntity.fromDomain(rule));
            log.info("Created tip-out rule {}: {} -> {} at {}% of {} (cap {})",
                rule.getId(), rule.getFromRole(), rule.getToRole(), percentage, rule.getBasisType(), maxPercentage);
            return rule;
        });
    }

    public TipOutRule update(UUID ruleId, BigDecimal percentage, BigDecimal maxPercentage, BasisType basisType,
                             Instant effectiveFrom, Instant expiresAt) {
        return transactionRunner.inTransaction("update tip-out rule", () -> {
            TipOutRuleEntity entity = load(ruleId);
            entity.revise(percentage, maxPercentage, basisType, effectiveFrom, expiresAt);
            log.info("Updated tip-out rule {}", ruleId);
            return entity.toDomain();
        });
    }

    public TipOutRule setActive(UUID ruleId, boolean active) {
        return transactionRunner.inTransaction("toggle tip-out rule", () -> {
            TipOutRuleEntity entity = load(ruleId);
            entity.setActive(active);
            log.info("Tip-out rule {} is now {}", ruleId, active ? "active" : "inactive");
            return entity.toDomain();
        });
    }

    public TipOutRule get(UUID ruleId) {
        return load(ruleId).toDomain();
    }

    public List<TipOutRule> rulesAt(UUID locationId) {
        return repository.findByLocationIdOrderByFromRoleAscToRoleAsc(locationId).stream()
            .map(TipOutRuleEntity::toDomain)
            .toList();
    }

    /**
     * Rules a {@code fromRole} employee is subject to at {@code at}, oldest first.
     */
    public List<TipOutRule> applicableRules(UUID locationId, String fromRole, Instant at) {
        return repository.findByLocationIdAndFromRoleAndActiveTrueOrderByCreatedAtAscIdAsc(
                locationId, Roles.normalize(fromRole)).stream()
            .map(TipOutRuleEntity::toDomain)
            .filter(rule -> rule.appliesAt(at))
            .toList();
    }

    private TipOutRuleEntity load(UUID ruleId) {
        return repository.findById(ruleId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_RULE, "Tip-out rule not found: %s", ruleId));
    }
}
