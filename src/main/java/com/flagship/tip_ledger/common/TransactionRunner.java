package com.flagship.tip_ledger.common;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.config.TipLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a unit of work in one database transaction and retries it when it
 * loses a row-lock race.
 *
 * Lock waits are bounded with {@code SET LOCAL lock_timeout}, so a contended
 * row surfaces as {@link org.springframework.dao.CannotAcquireLockException}
 * instead of blocking. The whole transaction is retried, never a single
 * statement. After the last attempt the caller gets {@link ErrorKind#BUSY}.
 *
 * When a transaction is already active the work simply joins it; the outermost
 * caller owns the retry.
 */
@Component
@Slf4j
public class TransactionRunner {

    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final String lockTimeoutStatement;

    public TransactionRunner(PlatformTransactionManager transactionManager,
                             JdbcTemplate jdbcTemplate,
                             TipLedgerProperties properties) {
        TipLedgerProperties.Retry retry = properties.retry();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutStatement = "SET LOCAL lock_timeout = '" + retry.lockTimeout().toMillis() + "ms'";
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(retry.maxAttempts())
                .exponentialBackoff(retry.initialBackoff().toMillis(), 2.0, retry.maxBackoff().toMillis())
                .retryOn(List.of(ConcurrencyFailureException.class, QueryTimeoutException.class))
                .traversingCauses()
                .build();
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying {} after lock conflict (attempt {})", operation, context.getRetryCount() + 1);
                }
                return transactionTemplate.execute(status -> {
                    jdbcTemplate.execute(lockTimeoutStatement);
                    return work.get();
                });
            });
        } catch (ConcurrencyFailureException | QueryTimeoutException e) {
            log.warn("Giving up on {} after repeated lock conflicts: {}", operation, e.getMessage());
            throw new TipLedgerException(ErrorKind.BUSY,
                    "Too much contention on " + operation + ", retry later", e);
        }
    }
}
