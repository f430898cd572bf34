package com.flagship.tip_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tip_ledger.attribution.AttributionResult;
import com.flagship.tip_ledger.attribution.AttributionService;
import com.flagship.tip_ledger.attribution.Tender;
import com.flagship.tip_ledger.attribution.TipCollection;
import com.flagship.tip_ledger.attribution.TipTarget;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.debt.ChargebackService;
import com.flagship.tip_ledger.event.TipAttributedEvent;
import com.flagship.tip_ledger.event.TipChargedBackEvent;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tip events are written in the same transaction as the postings they describe
 * and relayed with retry bookkeeping.
 */
@SpringBootTest
@Testcontainers
class OutboxServiceTest {

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

    private static final String AGGREGATE_TYPE = "TipTransaction";

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AttributionService attributionService;

    @Autowired
    private ChargebackService chargebackService;

    @Autowired
    private EmployeeService employeeService;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID locationId;
    private UUID server;

    @BeforeEach
    void setUp() {
        locationId = UUID.randomUUID();
        server = employeeService.register(locationId, "Sam", "SERVER", null).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private TipCollection tip(String paymentId, UUID employeeId) {
        return TipCollection.builder()
            .paymentId(paymentId)
            .locationId(locationId)
            .amountCents(900)
            .collectedAt(Instant.parse("2024-05-01T20:00:00Z"))
            .target(TipTarget.employee(employeeId))
            .tender(Tender.CASH)
            .build();
    }

    @Test
    @DisplayName("Attribution and chargeback each write one event for the tip transaction")
    void testEventsWrittenWithPostings() throws Exception {
        printTestHeader("Events Written With Postings");
        String paymentId = "pay-" + UUID.randomUUID();

        AttributionResult result = attributionService.attributeAndPost(tip(paymentId, server));
        attributionService.attributeAndPost(tip(paymentId, server));
        chargebackService.onChargeback(paymentId);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AGGREGATE_TYPE, result.getTransaction().getId());
        assertEquals(2, events.size(), "A replayed payment writes no second event");
        assertEquals(TipAttributedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertEquals(TipChargedBackEvent.EVENT_TYPE, events.get(1).getEventType());

        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(paymentId, payload.get("paymentId").asText());
        assertEquals(900, payload.get("amountCents").asLong());
        printSuccess("Events follow the postings in order");
    }

    @Test
    @DisplayName("A failed attribution leaves no event behind")
    void testNoEventWhenAttributionFails() {
        printTestHeader("No Event On Failure");
        long before = outboxService.countUnpublished();

        assertThrows(TipLedgerException.class,
            () -> attributionService.attributeAndPost(tip("pay-" + UUID.randomUUID(), UUID.randomUUID())));

        assertEquals(before, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Relaying records failures and marks delivered events published")
    void testRelayBatch() {
        printTestHeader("Relay Batch");
        AttributionResult result = attributionService.attributeAndPost(tip("pay-" + UUID.randomUUID(), server));
        UUID transactionId = result.getTransaction().getId();

        outboxService.relayBatch(1000, 5, event -> {
            throw new IllegalStateException("Broker not available");
        });
        OutboxEvent failed = outboxService.getEventsForAggregate(AGGREGATE_TYPE, transactionId).get(0);
        assertNull(failed.getPublishedAt());
        assertEquals(1, failed.getRetryCount());
        assertEquals("Broker not available", failed.getLastError());

        List<UUID> delivered = new ArrayList<>();
        OutboxService.RelayOutcome outcome = outboxService.relayBatch(1000, 5, event -> delivered.add(event.getId()));

        assertTrue(outcome.sent() >= 1);
        assertEquals(0, outcome.failed());
        assertTrue(delivered.contains(failed.getId()));
        assertNotNull(outboxService.getEventsForAggregate(AGGREGATE_TYPE, transactionId).get(0).getPublishedAt());
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Event relayed after one failed attempt");
    }
}
