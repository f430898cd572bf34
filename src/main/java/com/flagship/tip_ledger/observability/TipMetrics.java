package com.flagship.tip_ledger.observability;

import com.flagship.tip_ledger.ledger.EntrySourceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for the tip engine.
 *
 * Metrics exposed:
 * - tip.ledger.postings / tip.ledger.posted.cents: entries appended, by source type
 * - tip.ledger.duplicate_posts: postings answered from an existing idempotency key
 * - tip.attributed: attributions by target type and outcome
 * - tip.attribution.duration: attribution latency
 * - tip.chargebacks: chargebacks by policy
 * - tip.debt.recovered.cents: debt recovered out of later credits
 * - tip.banked.collected: banked shares collected
 * - tip.pool.changes: pool lifecycle changes
 * - tip.integrity.violations: refused writes, by check
 */
@Component
public class TipMetrics {

    private final MeterRegistry registry;

    private final Counter duplicatePosts;
    private final Counter bankedCollected;
    private final DistributionSummary debtRecovered;
    private final Timer attributionTimer;

    public TipMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicatePosts = Counter.builder("tip.ledger.duplicate_posts")
                .description("Postings answered from an existing idempotency key")
                .register(registry);

        this.bankedCollected = Counter.builder("tip.banked.collected")
                .description("Banked shares collected by their owner")
                .register(registry);

        this.debtRecovered = DistributionSummary.builder("tip.debt.recovered.cents")
                .description("Cents recovered from later credits against open tip debts")
                .baseUnit("cents")
                .register(registry);

        this.attributionTimer = Timer.builder("tip.attribution.duration")
                .description("Time taken to attribute and post one tip")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordPosting(EntrySourceType sourceType, long amountCents) {
        String source = sanitizeTag(sourceType.name());
        registry.counter("tip.ledger.postings", "source_type", source).increment();
        registry.counter("tip.ledger.posted.cents",
                "source_type", source,
                "direction", amountCents >= 0 ? "credit" : "debit"
        ).increment(Math.abs(amountCents));
    }

    public void recordDuplicatePost() {
        duplicatePosts.increment();
    }

    // ==================== Attribution ====================

    public void recordAttribution(String targetType, String outcome) {
        registry.counter("tip.attributed",
                "target_type", sanitizeTag(targetType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordAttributionDuration(long durationMs) {
        attributionTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordTipOut(boolean banked) {
        registry.counter("tip.tipout.recipients", "banked", String.valueOf(banked)).increment();
    }

    // ==================== Chargebacks and debt ====================

    public void recordChargeback(String policy) {
        registry.counter("tip.chargebacks", "policy", sanitizeTag(policy)).increment();
    }

    public void recordDebtRecovered(long amountCents, boolean fullyRecovered) {
        debtRecovered.record(amountCents);
        if (fullyRecovered) {
            registry.counter("tip.debt.closed", "reason", "recovered").increment();
        }
    }

    public void recordDebtWrittenOff() {
        registry.counter("tip.debt.closed", "reason", "written_off").increment();
    }

    // ==================== Bank and pools ====================

    public void recordBankedShareCollected() {
        bankedCollected.increment();
    }

    public void recordPoolChange(String change) {
        registry.counter("tip.pool.changes", "change", sanitizeTag(change)).increment();
    }

    public void recordIntegrityViolation(String check) {
        registry.counter("tip.integrity.violations", "check", sanitizeTag(check)).increment();
    }

    /**
     * Keeps tag values bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
