package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.attribution.AttributionResult;
import com.flagship.tip_ledger.attribution.AttributionService;
import com.flagship.tip_ledger.attribution.Tender;
import com.flagship.tip_ledger.attribution.TipCollection;
import com.flagship.tip_ledger.attribution.TipTarget;
import com.flagship.tip_ledger.attribution.TipTransactionStatus;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.ledger.EntrySourceType;
import com.flagship.tip_ledger.ledger.LedgerEntry;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.shift.EmployeeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chargebacks reverse the tip credits and leave a debt that later earnings pay down.
 */
@SpringBootTest
@Testcontainers
class ChargebackIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("tip_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("tip-ledger.chargeback.policy", () -> "REVERSE_AND_RECOVER");
    }

    private static final Instant COLLECTED_AT = Instant.parse("2024-05-01T20:00:00Z");

    @Autowired
    private AttributionService attributionService;

    @Autowired
    private ChargebackService chargebackService;

    @Autowired
    private DebtService debtService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private EmployeeService employeeService;

    private UUID locationId;
    private UUID server;

    @BeforeEach
    void setUp() {
        locationId = UUID.randomUUID();
        server = employeeService.register(locationId, "Sam", "SERVER", "PATIO").getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private AttributionResult directTip(String paymentId, long cents) {
        return attributionService.attributeAndPost(TipCollection.builder()
            .paymentId(paymentId)
            .locationId(locationId)
            .amountCents(cents)
            .collectedAt(COLLECTED_AT)
            .target(TipTarget.employee(server))
            .tender(Tender.CASH)
            .build());
    }

    @Test
    @DisplayName("A chargeback reverses the credit and opens a debt that later tips recover")
    void testChargebackThenRecovery() {
        printTestHeader("Chargeback Then Recovery");
        String paymentId = "pay-" + UUID.randomUUID();
        directTip(paymentId, 1000);
        assertEquals(1000, ledgerService.balance(server));

        ChargebackResult chargeback = chargebackService.onChargeback(paymentId);
        printOutput("Reversed", chargeback.reversedCents());
        printOutput("Debt", chargeback.debtCents());

        assertFalse(chargeback.isDuplicate());
        assertEquals(TipTransactionStatus.CHARGED_BACK, chargeback.getTransaction().getStatus());
        assertEquals(1000, chargeback.reversedCents());
        assertEquals(1000, chargeback.debtCents());
        assertEquals(0, ledgerService.balance(server));

        AttributionResult small = directTip("pay-" + UUID.randomUUID(), 600);
        printOutput("Recovered from 600 tip", small.getDebtRecoveries());
        assertEquals(0, ledgerService.balance(server), "The whole 600 credit goes to the debt");
        List<TipDebt> open = debtService.openDebts(server);
        assertEquals(1, open.size());
        assertEquals(400, open.get(0).getRemainingCents());

        directTip("pay-" + UUID.randomUUID(), 1000);
        assertEquals(600, ledgerService.balance(server), "Only the 400 still owed is recovered");
        assertTrue(debtService.openDebts(server).isEmpty());
        TipDebt settled = debtService.get(open.get(0).getId());
        assertEquals(DebtStatus.RECOVERED, settled.getStatus());
        assertEquals(0, settled.getRemainingCents());

        ledgerService.verifyBalance(ledgerService.accountOf(server).getId());
        printSuccess("Debt recovered exactly, never beyond what was owed");
    }

    @Test
    @DisplayName("Concurrent credits to an account in debt never recover more than is owed")
    void testConcurrentCreditsRecoverDebtOnce() throws Exception {
        printTestHeader("Concurrent Credits Against Debt");
        String paymentId = "pay-" + UUID.randomUUID();
        directTip(paymentId, 1000);
        chargebackService.onChargeback(paymentId);
        TipDebt debt = debtService.openDebts(server).get(0);
        assertEquals(1000, debt.getRemainingCents());

        int tips = 6;
        ExecutorService executor = Executors.newFixedThreadPool(tips);
        CountDownLatch ready = new CountDownLatch(tips);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AttributionResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < tips; i++) {
                String tipPayment = "pay-" + UUID.randomUUID();
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    return directTip(tipPayment, 300);
                }));
            }
            assertTrue(ready.await(10, TimeUnit.SECONDS));
            start.countDown();
            for (Future<AttributionResult> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long recovered = -ledgerService.entriesForSource(EntrySourceType.DEBT_RECOVERY, debt.getId()).stream()
            .mapToLong(LedgerEntry::getAmountCents)
            .sum();
        printOutput("Recovered", recovered);
        printOutput("Balance", ledgerService.balance(server));

        assertEquals(1000, recovered);
        assertEquals(6 * 300 - 1000, ledgerService.balance(server));
        TipDebt settled = debtService.get(debt.getId());
        assertEquals(DebtStatus.RECOVERED, settled.getStatus());
        assertEquals(0, settled.getRemainingCents());
        assertEquals(ledgerService.balance(server),
            ledgerService.recomputeBalance(ledgerService.accountOf(server).getId()));
        printSuccess("Recovery stopped exactly at the amount owed");
    }

    @Test
    @DisplayName("Replaying a chargeback changes nothing")
    void testChargebackIsIdempotent() {
        printTestHeader("Chargeback Replay");
        String paymentId = "pay-" + UUID.randomUUID();
        directTip(paymentId, 800);

        ChargebackResult first = chargebackService.onChargeback(paymentId);
        ChargebackResult replay = chargebackService.onChargeback(paymentId);

        assertTrue(replay.isDuplicate());
        assertEquals(first.reversedCents(), replay.reversedCents());
        assertEquals(first.debtCents(), replay.debtCents());
        assertEquals(1, debtService.debtsOf(server).size());
        assertEquals(0, ledgerService.balance(server));
    }

    @Test
    @DisplayName("A chargeback for an unknown payment is refused")
    void testUnknownPayment() {
        printTestHeader("Unknown Payment Chargeback");

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> chargebackService.onChargeback("pay-missing-" + UUID.randomUUID()));
        assertEquals(ErrorKind.UNKNOWN_TIP_TRANSACTION, e.getKind());
    }

    @Test
    @DisplayName("A written-off debt is no longer recovered")
    void testWriteOffStopsRecovery() {
        printTestHeader("Write-Off Stops Recovery");
        String paymentId = "pay-" + UUID.randomUUID();
        directTip(paymentId, 500);
        chargebackService.onChargeback(paymentId);
        TipDebt debt = debtService.openDebts(server).get(0);

        debtService.writeOff(debt.getId(), "Guest dispute lost by the house", "gm");
        directTip("pay-" + UUID.randomUUID(), 300);

        assertEquals(300, ledgerService.balance(server));
        assertEquals(DebtStatus.WRITTEN_OFF, debtService.get(debt.getId()).getStatus());
    }
}
