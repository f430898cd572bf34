package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.attribution.AttributionResult;
import com.flagship.tip_ledger.attribution.AttributionService;
import com.flagship.tip_ledger.attribution.Tender;
import com.flagship.tip_ledger.attribution.TipCollection;
import com.flagship.tip_ledger.attribution.TipTarget;
import com.flagship.tip_ledger.bank.BankService;
import com.flagship.tip_ledger.bank.BankedShare;
import com.flagship.tip_ledger.bank.BankedShareStatus;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.ledger.LedgerService;
import com.flagship.tip_ledger.shift.EmployeeService;
import com.flagship.tip_ledger.shift.TimeClockService;
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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Role tip-outs: on-duty recipients of the role are credited at once. Only when
 * nobody of the role is on duty is the amount banked, to be collected on a later shift.
 */
@SpringBootTest
@Testcontainers
class TipOutIntegrationTest {

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
    }

    private static final Instant SHIFT_START = Instant.parse("2024-05-01T16:00:00Z");
    private static final Instant COLLECTED_AT = Instant.parse("2024-05-01T20:00:00Z");
    private static final Instant NEXT_SHIFT = Instant.parse("2024-05-02T16:00:00Z");

    @Autowired
    private AttributionService attributionService;

    @Autowired
    private TipOutRuleService ruleService;

    @Autowired
    private BankService bankService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private EmployeeService employeeService;

    @Autowired
    private TimeClockService timeClockService;

    private UUID locationId;
    private UUID server;
    private UUID busserOnDuty;
    private UUID busserOffDuty;

    @BeforeEach
    void setUp() {
        locationId = UUID.randomUUID();
        server = employeeService.register(locationId, "Sam", "SERVER", null).getId();
        busserOnDuty = employeeService.register(locationId, "Ben", "BUSSER", null).getId();
        busserOffDuty = employeeService.register(locationId, "Bea", "BUSSER", null).getId();
        timeClockService.clockIn(server, null, null, SHIFT_START);
        timeClockService.clockIn(busserOnDuty, null, null, SHIFT_START);
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

    private AttributionResult serverTip(String paymentId, long cents) {
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
    @DisplayName("Tip-outs are split among on-duty recipients only")
    void testTipOutToOnDutyRecipients() {
        printTestHeader("Tip-Out To On-Duty Recipients");
        ruleService.create(locationId, "SERVER", "BUSSER", BigDecimal.TEN, null, BasisType.TIPS_EARNED, null, null);

        AttributionResult result = serverTip("pay-" + UUID.randomUUID(), 1000);
        printOutput("Tip-outs", result.getTipOuts());

        assertEquals(1, result.getTipOuts().size());
        TipOutApplication applied = result.getTipOuts().get(0);
        assertEquals(100, applied.getAmountCents());
        assertEquals(1, applied.getCredited().size());
        assertTrue(applied.getBanked().isEmpty());
        assertEquals(900, ledgerService.balance(server));
        assertEquals(100, ledgerService.balance(busserOnDuty));
        assertEquals(0, ledgerService.balance(busserOffDuty));
        assertTrue(bankService.pendingBankedShares(busserOnDuty).isEmpty());
        assertTrue(bankService.pendingBankedShares(busserOffDuty).isEmpty());
        printSuccess("The on-duty busser received the whole tip-out");
    }

    @Test
    @DisplayName("With nobody of the role on duty, the tip-out is banked across the role")
    void testTipOutBankedWhenNobodyOnDuty() {
        printTestHeader("Tip-Out Banked When Nobody On Duty");
        ruleService.create(locationId, "SERVER", "HOST", BigDecimal.TEN, null, BasisType.TIPS_EARNED, null, null);
        UUID hal = employeeService.register(locationId, "Hal", "HOST", null).getId();
        UUID hana = employeeService.register(locationId, "Hana", "HOST", null).getId();

        AttributionResult result = serverTip("pay-" + UUID.randomUUID(), 1000);
        printOutput("Tip-outs", result.getTipOuts());

        TipOutApplication applied = result.getTipOuts().get(0);
        assertTrue(applied.getCredited().isEmpty());
        assertEquals(2, applied.getBanked().size());
        assertEquals(900, ledgerService.balance(server));
        assertEquals(0, ledgerService.balance(hal));
        assertEquals(0, ledgerService.balance(hana));

        List<BankedShare> pending = bankService.pendingBankedShares(hal);
        assertEquals(1, pending.size());
        assertEquals(50, pending.get(0).getAmountCents());
        assertEquals(50, bankService.pendingBankedShares(hana).get(0).getAmountCents());

        TipLedgerException notOnDuty = assertThrows(TipLedgerException.class,
            () -> bankService.collect(pending.get(0).getId(), NEXT_SHIFT));
        assertEquals(ErrorKind.NOT_ON_DUTY, notOnDuty.getKind());

        timeClockService.clockIn(hal, null, null, NEXT_SHIFT);
        BankedShare collected = bankService.collect(pending.get(0).getId(), NEXT_SHIFT.plusSeconds(60));
        BankedShare again = bankService.collect(pending.get(0).getId(), NEXT_SHIFT.plusSeconds(120));

        assertEquals(BankedShareStatus.COLLECTED, collected.getStatus());
        assertEquals(collected.getLedgerEntryId(), again.getLedgerEntryId());
        assertEquals(50, ledgerService.balance(hal));
        assertTrue(bankService.pendingBankedShares(hal).isEmpty());
        assertEquals(1, bankService.pendingBankedShares(hana).size());
        printSuccess("Banked share collected exactly once");
    }

    @Test
    @DisplayName("Replaying a tipped payment does not repeat its tip-outs")
    void testTipOutReplay() {
        printTestHeader("Tip-Out Replay");
        ruleService.create(locationId, "SERVER", "BUSSER", BigDecimal.TEN, null, BasisType.TIPS_EARNED, null, null);
        String paymentId = "pay-" + UUID.randomUUID();

        serverTip(paymentId, 1000);
        serverTip(paymentId, 1000);

        assertEquals(900, ledgerService.balance(server));
        assertEquals(100, ledgerService.balance(busserOnDuty));
        assertEquals(0, ledgerService.balance(busserOffDuty));
        assertTrue(bankService.pendingBankedShares(busserOffDuty).isEmpty());
    }

    @Test
    @DisplayName("Inactive and expired rules are not applied")
    void testInactiveRulesIgnored() {
        printTestHeader("Inactive Rules Ignored");
        TipOutRule rule = ruleService.create(locationId, "SERVER", "BUSSER", BigDecimal.TEN, null,
            BasisType.TIPS_EARNED, null, null);
        ruleService.setActive(rule.getId(), false);
        ruleService.create(locationId, "SERVER", "BUSSER", BigDecimal.TEN, null, BasisType.TIPS_EARNED,
            null, COLLECTED_AT);

        AttributionResult result = serverTip("pay-" + UUID.randomUUID(), 1000);

        assertTrue(result.getTipOuts().isEmpty());
        assertEquals(1000, ledgerService.balance(server));
    }

    @Test
    @DisplayName("Cumulative tip-outs never exceed the giver's share")
    void testTipOutsCappedByShare() {
        printTestHeader("Tip-Outs Capped By Share");
        ruleService.create(locationId, "SERVER", "BUSSER", new BigDecimal("80"), null, BasisType.TIPS_EARNED,
            null, null);
        ruleService.create(locationId, "SERVER", "HOST", new BigDecimal("50"), null, BasisType.TIPS_EARNED,
            null, null);
        UUID host = employeeService.register(locationId, "Hal", "HOST", null).getId();
        timeClockService.clockIn(host, null, null, SHIFT_START);

        AttributionResult result = serverTip("pay-" + UUID.randomUUID(), 1000);
        printOutput("Tip-outs", result.getTipOuts());

        assertEquals(0, ledgerService.balance(server));
        assertEquals(800, ledgerService.balance(busserOnDuty));
        assertEquals(0, ledgerService.balance(busserOffDuty));
        assertEquals(200, ledgerService.balance(host));
        assertEquals(1000, result.getTipOuts().stream().mapToLong(TipOutApplication::getAmountCents).sum());
    }
}
