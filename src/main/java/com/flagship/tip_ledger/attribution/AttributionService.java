package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.common.IdOrder;
import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.config.TipLedgerProperties;
import com.flagship.tip_ledger.event.TipAttributedEvent;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.ledger.PostingRequest;
import com.flagship.tip_ledger.ledger.PostingResult;
import com.flagship.tip_ledger.observability.CorrelationContext;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import com.flagship.tip_ledger.pool.PoolSegment;
import com.flagship.tip_ledger.pool.PoolService;
import com.flagship.tip_ledger.shift.ShiftDirectory;
import com.flagship.tip_ledger.tipout.TipOutApplication;
import com.flagship.tip_ledger.tipout.TipOutService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one collected tip into exact per-employee credits.
 *
 * A direct tip for an employee who was in a pool at the collection instant is
 * split by that pool's segment instead. A co-owned table is split by the
 * owners' percentages with the same remainder rule as pools.
 *
 * The transaction id is derived from the payment id, and every credit key from
 * the transaction id and the employee, so a replayed payment lands on the rows
 * written the first time. Resolving the pool segment, posting the credits,
 * applying tip-outs and writing the outbox event share one database transaction.
 */
@Service
@Slf4j
public class AttributionService {

    private static final String AGGREGATE_TYPE = "TipTransaction";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TipTransactionRepository transactionRepository;
    private final PaymentIdempotencyService idempotencyService;
    private final PoolService poolService;
    private final LedgerService ledgerService;
    private final TipOutService tipOutService;
    private final ShiftDirectory shiftDirectory;
    private final OutboxService outboxService;
    private final TransactionRunner transactionRunner;
    private final TipMetrics metrics;
    private final TipLedgerProperties.CardFee cardFee;

    public AttributionService(TipTransactionRepository transactionRepository,
                              PaymentIdempotencyService idempotencyService,
                              PoolService poolService,
                              LedgerService ledgerService,
                              TipOutService tipOutService,
                              ShiftDirectory shiftDirectory,
                              OutboxService outboxService,
                              TransactionRunner transactionRunner,
                              TipMetrics metrics,
                              TipLedgerProperties properties) {
        this.transactionRepository = transactionRepository;
        this.idempotencyService = idempotencyService;
        this.poolService = poolService;
        this.ledgerService = ledgerService;
        this.tipOutService = tipOutService;
        this.shiftDirectory = shiftDirectory;
        this.outboxService = outboxService;
        this.transactionRunner = transactionRunner;
        this.metrics = metrics;
        this.cardFee = properties.cardFee();
    }

    /**
     * Attributes and posts a tip. Calling it again for the same payment returns
     * the original result with {@code duplicate = true}.
     *
     * @throws TipLedgerException SEGMENT_NOT_FOUND when no segment of the target pool
     *         covers {@code collectedAt}; EMPTY_POOL when the covering segment has no members
     */
    public AttributionResult attributeAndPost(TipCollection collection) {
        long startTime = System.currentTimeMillis();
        String targetType = collection.getTarget().typeName();

        try (MDC.MDCCloseable ignored = CorrelationContext.scoped(
                CorrelationContext.PAYMENT_ID_MDC_KEY, collection.getPaymentId())) {

            Optional<UUID> known = idempotencyService.findAttributed(collection.getPaymentId());
            if (known.isPresent()) {
                log.debug("Payment already attributed to tip transaction {}", known.get());
                metrics.recordAttribution(targetType, "duplicate");
                return existingResult(collection.getPaymentId());
            }

            long fee = cardFeeFor(collection);
            long net = collection.getAmountCents() - fee;
            if (net <= 0) {
                throw TipLedgerException.validation("Card fee of %d cents leaves nothing of a %d cent tip",
                    fee, collection.getAmountCents());
            }
            if (collection.getTarget() instanceof TipTarget.Employee direct) {
                requireEmployee(direct.employeeId());
            } else if (collection.getTarget() instanceof TipTarget.Ownership owned) {
                owned.owners().forEach(owner -> requireEmployee(owner.employeeId()));
            }

            AttributionResult result = transactionRunner.inTransaction("attribute tip",
                () -> attributeLocked(collection, fee, net));
            idempotencyService.remember(collection.getPaymentId(), result.getTransaction().getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordAttribution(targetType, "posted");
            metrics.recordAttributionDuration(duration);
            log.info("Attributed {} cents ({} gross) to {} employees, {} tip-outs, duration={}ms",
                net, collection.getAmountCents(), result.getCredits().size(), result.getTipOuts().size(), duration);
            return result;

        } catch (DuplicateKeyException e) {
            log.debug("Lost the race for payment {}, returning the winner's result", collection.getPaymentId());
            metrics.recordAttribution(targetType, "duplicate");
            return existingResult(collection.getPaymentId());
        } catch (TipLedgerException e) {
            metrics.recordAttribution(targetType, e.getKind().name());
            throw e;
        }
    }

    private AttributionResult attributeLocked(TipCollection collection, long fee, long net) {
        UUID transactionId = IdempotencyKeys.tipTransactionId(collection.getPaymentId());
        TipTransaction.TipTransactionBuilder transaction = TipTransaction.builder()
            .id(transactionId)
            .paymentId(collection.getPaymentId())
            .locationId(collection.getLocationId())
            .kind(collection.getKind())
            .tender(collection.getTender())
            .grossAmountCents(collection.getAmountCents())
            .cardFeeCents(fee)
            .amountCents(net)
            .salesAmountCents(collection.getSalesAmountCents())
            .section(collection.getSection())
            .collectedAt(collection.getCollectedAt())
            .targetType(collection.getTarget().typeName())
            .status(TipTransactionStatus.POSTED)
            .createdAt(Instant.now());

        List<EmployeeShare> shares;
        if (collection.getTarget() instanceof TipTarget.Pool pooled) {
            shares = allocateToPool(transaction, pooled.poolId(), collection.getCollectedAt(), net);
        } else if (collection.getTarget() instanceof TipTarget.Ownership owned) {
            shares = ShareAllocator.allocate(net, owned.ratios());
        } else {
            UUID employeeId = ((TipTarget.Employee) collection.getTarget()).employeeId();
            transaction.employeeId(employeeId);
            Optional<UUID> activePool = poolService.activePoolOf(collection.getLocationId(), employeeId,
                collection.getCollectedAt());
            if (activePool.isPresent()) {
                log.info("Employee {} was pooled in {} at {}; routing the tip to the pool",
                    employeeId, activePool.get(), collection.getCollectedAt());
                shares = allocateToPool(transaction, activePool.get(), collection.getCollectedAt(), net);
                transaction.targetType(TipTarget.pool(activePool.get()).typeName());
            } else {
                shares = List.of(new EmployeeShare(employeeId, net));
            }
        }
        if (ShareAllocator.total(shares) != net) {
            log.error("Refusing attribution of payment {}: shares {} do not sum to {}",
                collection.getPaymentId(), shares, net);
            metrics.recordIntegrityViolation("share_sum");
            throw TipLedgerException.of(ErrorKind.INTEGRITY_VIOLATION,
                "Shares sum to %d instead of %d", ShareAllocator.total(shares), net);
        }

        try {
            TipTransaction saved = transaction.build();
            transactionRepository.insert(saved);

            List<LedgerEntry> credits = new ArrayList<>();
            List<LedgerEntry> recoveries = new ArrayList<>();
            for (EmployeeShare share : shares) {
                if (share.getShareCents() == 0) {
                    continue;
                }
                PostingResult posted = ledgerService.post(PostingRequest.builder()
                    .accountId(ledgerService.accountOf(share.getEmployeeId()).getId())
                    .amountCents(share.getShareCents())
                    .sourceType(EntrySourceType.TIP_TRANSACTION)
                    .sourceId(transactionId)
                    .idempotencyKey(IdempotencyKeys.tipCredit(transactionId, share.getEmployeeId()))
                    .memo(saved.getKind() + " " + saved.getPaymentId())
                    .build());
                credits.add(posted.getEntry());
                recoveries.addAll(posted.getRecoveries());
            }

            List<TipOutApplication> tipOuts = tipOutService.apply(saved, shares);
            outboxService.saveEvent(AGGREGATE_TYPE, transactionId, TipAttributedEvent.from(saved, shares));

            return new AttributionResult(saved, shares, List.copyOf(credits), List.copyOf(recoveries),
                List.copyOf(tipOuts), false);
        } finally {
            MDC.remove(CorrelationContext.POOL_ID_MDC_KEY);
        }
    }

    private List<EmployeeShare> allocateToPool(TipTransaction.TipTransactionBuilder transaction, UUID poolId,
                                               Instant collectedAt, long net) {
        PoolSegment segment = resolveSegment(poolId, collectedAt);
        transaction.poolId(poolId).segmentId(segment.getId());
        MDC.put(CorrelationContext.POOL_ID_MDC_KEY, poolId.toString());
        return ShareAllocator.allocate(net, segment.getShares());
    }

    private PoolSegment resolveSegment(UUID poolId, Instant collectedAt) {
        PoolSegment segment;
        try {
            segment = poolService.segmentForAttribution(poolId, collectedAt);
        } catch (TipLedgerException e) {
            if (e.is(ErrorKind.NO_ACTIVE_SEGMENT)) {
                throw new TipLedgerException(ErrorKind.SEGMENT_NOT_FOUND, e.getMessage(), e);
            }
            throw e;
        }
        if (segment.isEmpty()) {
            throw TipLedgerException.of(ErrorKind.EMPTY_POOL,
                "Segment %s of pool %s has no members at %s", segment.getId(), poolId, collectedAt);
        }
        return segment;
    }

    /**
     * Rebuilds the result of an earlier attribution from what it wrote.
     */
    public AttributionResult existingResult(String paymentId) {
        TipTransaction transaction = transactionRepository.findByPaymentId(paymentId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_TIP_TRANSACTION,
                "No tip transaction for payment %s", paymentId));

        List<LedgerEntry> credits = ledgerService.entriesForSource(EntrySourceType.TIP_TRANSACTION, transaction.getId());
        List<LedgerEntry> recoveries = new ArrayList<>();
        List<EmployeeShare> shares = new ArrayList<>();
        for (LedgerEntry credit : credits) {
            shares.add(new EmployeeShare(ledgerService.getAccount(credit.getAccountId()).getEmployeeId(),
                credit.getAmountCents()));
            recoveries.addAll(ledgerService.recoveriesFor(credit.getId()));
        }
        shares.sort(Comparator.comparing(EmployeeShare::getEmployeeId, IdOrder.ASCENDING));
        return new AttributionResult(transaction, List.copyOf(shares), credits, List.copyOf(recoveries),
            List.of(), true);
    }

    public TipTransaction getTransaction(UUID tipTransactionId) {
        return transactionRepository.findById(tipTransactionId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_TIP_TRANSACTION,
                "Tip transaction not found: %s", tipTransactionId));
    }

    long cardFeeFor(TipCollection collection) {
        if (!cardFee.deductFromTips() || !collection.getTender().isCard() || cardFee.percent().signum() <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(collection.getAmountCents())
            .multiply(cardFee.percent())
            .divide(HUNDRED, 0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    private void requireEmployee(UUID employeeId) {
        if (shiftDirectory.roleOf(employeeId).isEmpty()) {
            throw TipLedgerException.of(ErrorKind.UNKNOWN_EMPLOYEE, "Employee not found: %s", employeeId);
        }
    }
}
