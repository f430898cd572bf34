package com.flagship.tip_ledger.config;

import com.flagship.tip_ledger.debt.ChargebackPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Engine knobs bound from the {@code tip-ledger.*} namespace.
 */
@ConfigurationProperties("tip-ledger")
public record TipLedgerProperties(
        @DefaultValue Chargeback chargeback,
        @DefaultValue CardFee cardFee,
        @DefaultValue Retry retry,
        @DefaultValue History history) {

    /**
     * @param policy how a confirmed chargeback is charged to the credited employees
     */
    public record Chargeback(@DefaultValue("REVERSE_AND_RECOVER") ChargebackPolicy policy) {
    }

    /**
     * @param deductFromTips whether card tips lose the processing fee before attribution
     * @param percent fee percentage, e.g. 2.5 for 2.5%
     */
    public record CardFee(boolean deductFromTips, @DefaultValue("0") BigDecimal percent) {
    }

    /**
     * @param lockTimeout longest a single statement may wait on a row lock
     */
    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("50ms") Duration initialBackoff,
            @DefaultValue("500ms") Duration maxBackoff,
            @DefaultValue("2s") Duration lockTimeout) {
    }

    public record History(@DefaultValue("200") int pageSize) {
    }

    public static TipLedgerProperties defaults() {
        return new TipLedgerProperties(
                new Chargeback(ChargebackPolicy.REVERSE_AND_RECOVER),
                new CardFee(false, BigDecimal.ZERO),
                new Retry(3, Duration.ofMillis(50), Duration.ofMillis(500), Duration.ofSeconds(2)),
                new History(200));
    }
}
