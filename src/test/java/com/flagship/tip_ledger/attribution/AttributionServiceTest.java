package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.common.IdempotencyKeys;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.config.TipLedgerProperties;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerAccount;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.ledger.PostingRequest;
import com.flagship.tip_ledger.ledger.PostingResult;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import com.flagship.tip_ledger.pool.OpenSegment;
import com.flagship.tip_ledger.pool.PoolService;
import com.flagship.tip_ledger.pool.SegmentShare;
import com.flagship.tip_ledger.shift.ShiftDirectory;
import com.flagship.tip_ledger.tipout.TipOutService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Attribution rules that do not need a database: card fee, target checks and
 * segment resolution failures.
 */
@ExtendWith(MockitoExtension.class)
class AttributionServiceTest {

    private static final UUID LOCATION = UUID.randomUUID();
    private static final Instant COLLECTED_AT = Instant.parse("2024-05-01T20:15:00Z");

    @Mock
    private TipTransactionRepository transactionRepository;
    @Mock
    private PaymentIdempotencyService idempotencyService;
    @Mock
    private PoolService poolService;
    @Mock
    private LedgerService ledgerService;
    @Mock
    private TipOutService tipOutService;
    @Mock
    private ShiftDirectory shiftDirectory;
    @Mock
    private OutboxService outboxService;
    @Mock
    private TransactionRunner transactionRunner;
    @Mock
    private TipMetrics metrics;

    @BeforeEach
    void setUp() {
        lenient().when(transactionRunner.inTransaction(anyString(), any()))
            .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(1).get());
        lenient().when(idempotencyService.findAttributed(anyString())).thenReturn(Optional.empty());
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private AttributionService service(boolean deductFee, String percent) {
        TipLedgerProperties defaults = TipLedgerProperties.defaults();
        TipLedgerProperties properties = new TipLedgerProperties(defaults.chargeback(),
            new TipLedgerProperties.CardFee(deductFee, new BigDecimal(percent)),
            new TipLedgerProperties.Retry(1, Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1)),
            defaults.history());
        return new AttributionService(transactionRepository, idempotencyService, poolService, ledgerService,
            tipOutService, shiftDirectory, outboxService, transactionRunner, metrics, properties);
    }

    private static TipCollection.TipCollectionBuilder collection(long amountCents, TipTarget target) {
        return TipCollection.builder()
            .paymentId("pay-" + UUID.randomUUID())
            .locationId(LOCATION)
            .amountCents(amountCents)
            .collectedAt(COLLECTED_AT)
            .target(target);
    }

    @Test
    @DisplayName("Card fee is a rounded percentage of card tips only")
    void testCardFee() {
        printTestHeader("Card Fee");
        AttributionService service = service(true, "2.5");
        TipTarget target = TipTarget.employee(UUID.randomUUID());

        assertEquals(25, service.cardFeeFor(collection(1000, target).build()));
        assertEquals(25, service.cardFeeFor(collection(1001, target).build()));
        assertEquals(26, service.cardFeeFor(collection(1020, target).build()));
        assertEquals(0, service.cardFeeFor(collection(1000, target).tender(Tender.CASH).build()));
        assertEquals(0, service(false, "2.5").cardFeeFor(collection(1000, target).build()));
    }

    @Test
    @DisplayName("A fee that consumes the whole tip is rejected")
    void testFeeConsumesTip() {
        printTestHeader("Fee Consumes Tip");
        AttributionService service = service(true, "100");

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> service.attributeAndPost(collection(1, TipTarget.employee(UUID.randomUUID())).build()));

        assertEquals(ErrorKind.VALIDATION, e.getKind());
        verify(transactionRunner, never()).inTransaction(anyString(), any());
    }

    @Test
    @DisplayName("Direct tips to unknown employees are rejected before anything is written")
    void testUnknownEmployee() {
        printTestHeader("Unknown Employee");
        UUID employee = UUID.randomUUID();
        when(shiftDirectory.roleOf(employee)).thenReturn(Optional.empty());

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> service(false, "0").attributeAndPost(collection(500, TipTarget.employee(employee)).build()));

        assertEquals(ErrorKind.UNKNOWN_EMPLOYEE, e.getKind());
        verify(transactionRepository, never()).insert(any());
    }

    @Test
    @DisplayName("A pool tip collected after the pool ended reports SEGMENT_NOT_FOUND")
    void testEndedPool() {
        printTestHeader("Ended Pool");
        UUID poolId = UUID.randomUUID();
        when(poolService.segmentForAttribution(poolId, COLLECTED_AT))
            .thenThrow(TipLedgerException.of(ErrorKind.NO_ACTIVE_SEGMENT, "Pool %s ended", poolId));

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> service(false, "0").attributeAndPost(collection(500, TipTarget.pool(poolId)).build()));

        assertEquals(ErrorKind.SEGMENT_NOT_FOUND, e.getKind());
        verify(ledgerService, never()).post(any());
    }

    @Test
    @DisplayName("A pool tip landing in an empty segment reports EMPTY_POOL")
    void testEmptySegment() {
        printTestHeader("Empty Segment");
        UUID poolId = UUID.randomUUID();
        when(poolService.segmentForAttribution(poolId, COLLECTED_AT))
            .thenReturn(new OpenSegment(UUID.randomUUID(), poolId, COLLECTED_AT.minusSeconds(60), List.of()));

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> service(false, "0").attributeAndPost(collection(500, TipTarget.pool(poolId)).build()));

        assertEquals(ErrorKind.EMPTY_POOL, e.getKind());
        verify(transactionRepository, never()).insert(any());
    }

    @Test
    @DisplayName("A direct card tip credits the net amount under a key derived from the payment")
    void testDirectTipPostsNetCredit() {
        printTestHeader("Direct Tip Net Credit");
        UUID employee = UUID.randomUUID();
        UUID accountId = UUID.randomUUID();
        TipCollection tip = collection(1000, TipTarget.employee(employee)).build();
        UUID transactionId = IdempotencyKeys.tipTransactionId(tip.getPaymentId());

        when(shiftDirectory.roleOf(employee)).thenReturn(Optional.of("SERVER"));
        when(ledgerService.accountOf(employee))
            .thenReturn(new LedgerAccount(accountId, employee, LOCATION, 0, Instant.now(), Instant.now()));
        when(ledgerService.post(any())).thenAnswer(invocation -> {
            PostingRequest request = invocation.getArgument(0);
            LedgerEntry entry = new LedgerEntry(UUID.randomUUID(), request.getAccountId(), request.getAmountCents(),
                request.getSourceType(), request.getSourceId(), request.getIdempotencyKey(), null,
                request.getMemo(), Instant.now(), 1L);
            return PostingResult.posted(entry, List.of());
        });
        when(tipOutService.apply(any(), any())).thenReturn(List.of());

        AttributionResult result = service(true, "3").attributeAndPost(tip);

        ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
        verify(ledgerService).post(posted.capture());
        assertEquals(970, posted.getValue().getAmountCents());
        assertEquals(EntrySourceType.TIP_TRANSACTION, posted.getValue().getSourceType());
        assertEquals(IdempotencyKeys.tipCredit(transactionId, employee), posted.getValue().getIdempotencyKey());

        assertFalse(result.isDuplicate());
        assertEquals(transactionId, result.getTransaction().getId());
        assertEquals(30, result.getTransaction().getCardFeeCents());
        assertEquals(List.of(new EmployeeShare(employee, 970)), result.getShares());
        verify(outboxService).saveEvent(eq("TipTransaction"), eq(transactionId), any());
        verify(idempotencyService).remember(tip.getPaymentId(), transactionId);
    }

    private void stubPostings() {
        when(ledgerService.accountOf(any())).thenAnswer(invocation -> {
            UUID employeeId = invocation.getArgument(0);
            return new LedgerAccount(employeeId, employeeId, LOCATION, 0, Instant.now(), Instant.now());
        });
        when(ledgerService.post(any())).thenAnswer(invocation -> {
            PostingRequest request = invocation.getArgument(0);
            LedgerEntry entry = new LedgerEntry(UUID.randomUUID(), request.getAccountId(), request.getAmountCents(),
                request.getSourceType(), request.getSourceId(), request.getIdempotencyKey(), null,
                request.getMemo(), Instant.now(), 1L);
            return PostingResult.posted(entry, List.of());
        });
        when(tipOutService.apply(any(), any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("A direct tip for a pooled employee is split by the pool's segment")
    void testDirectTipRoutedToActivePool() {
        printTestHeader("Direct Tip Routed To Pool");
        UUID employee = UUID.randomUUID();
        UUID teammate = UUID.randomUUID();
        UUID poolId = UUID.randomUUID();
        OpenSegment segment = new OpenSegment(UUID.randomUUID(), poolId, COLLECTED_AT.minusSeconds(600), List.of(
            new SegmentShare(employee, new BigDecimal("0.5")), new SegmentShare(teammate, new BigDecimal("0.5"))));

        when(shiftDirectory.roleOf(employee)).thenReturn(Optional.of("BARTENDER"));
        when(poolService.activePoolOf(LOCATION, employee, COLLECTED_AT)).thenReturn(Optional.of(poolId));
        when(poolService.segmentForAttribution(poolId, COLLECTED_AT)).thenReturn(segment);
        stubPostings();

        AttributionResult result = service(false, "0").attributeAndPost(
            collection(1000, TipTarget.employee(employee)).tender(Tender.CASH).build());

        assertEquals(1000, ShareAllocator.total(result.getShares()));
        assertEquals(2, result.getShares().size());
        assertTrue(result.getShares().contains(new EmployeeShare(teammate, 500)));

        ArgumentCaptor<TipTransaction> inserted = ArgumentCaptor.forClass(TipTransaction.class);
        verify(transactionRepository).insert(inserted.capture());
        assertEquals("POOL", inserted.getValue().getTargetType());
        assertEquals(poolId, inserted.getValue().getPoolId());
        assertEquals(segment.getId(), inserted.getValue().getSegmentId());
        assertEquals(employee, inserted.getValue().getEmployeeId());
    }

    @Test
    @DisplayName("A co-owned table is split by the owners' percentages")
    void testOwnershipSplit() {
        printTestHeader("Ownership Split");
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(shiftDirectory.roleOf(any())).thenReturn(Optional.of("SERVER"));
        stubPostings();

        TipTarget owners = TipTarget.ownership(List.of(
            new TipTarget.Owner(first, new BigDecimal("60")), new TipTarget.Owner(second, new BigDecimal("40"))));
        AttributionResult result = service(false, "0").attributeAndPost(
            collection(1000, owners).tender(Tender.CASH).build());

        assertTrue(result.getShares().contains(new EmployeeShare(first, 600)));
        assertTrue(result.getShares().contains(new EmployeeShare(second, 400)));
        verify(ledgerService, times(2)).post(any());
        verify(poolService, never()).activePoolOf(any(), any(), any());

        ArgumentCaptor<TipTransaction> inserted = ArgumentCaptor.forClass(TipTransaction.class);
        verify(transactionRepository).insert(inserted.capture());
        assertEquals("OWNERSHIP", inserted.getValue().getTargetType());
        assertNull(inserted.getValue().getEmployeeId());
        assertNull(inserted.getValue().getPoolId());
    }

    @Test
    @DisplayName("Ownership percentages must add up to 100 with no owner listed twice")
    void testInvalidOwnership() {
        printTestHeader("Invalid Ownership");
        UUID owner = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () -> TipTarget.ownership(List.of(
            new TipTarget.Owner(owner, new BigDecimal("60")),
            new TipTarget.Owner(UUID.randomUUID(), new BigDecimal("30")))));
        assertThrows(IllegalArgumentException.class, () -> TipTarget.ownership(List.of(
            new TipTarget.Owner(owner, new BigDecimal("50")), new TipTarget.Owner(owner, new BigDecimal("50")))));
        assertThrows(IllegalArgumentException.class, () -> new TipTarget.Owner(owner, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> TipTarget.ownership(List.of()));
    }
}
