package com.flagship.tip_ledger.consumer;

import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
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

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Inbound payment events are handled at most once per consumer group, and
 * events that can never succeed are acknowledged as REJECTED.
 */
@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

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

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "tip-ledger-test";
    private static final String EVENT_TYPE = "PaymentCompleted";
    private static final String AGGREGATE_TYPE = "Payment";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private List<ProcessedEventEntity> recordsFor(String paymentId) {
        return repository.findByAggregateTypeAndAggregateKeyOrderByProcessedAtAsc(AGGREGATE_TYPE, paymentId);
    }

    @Test
    @DisplayName("A redelivered event does not run its handler again")
    void testDuplicateEvent_SkipsHandler() {
        printTestHeader("Duplicate Event");
        UUID eventId = UUID.randomUUID();
        String paymentId = "pay-" + UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP,
            calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP,
            calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertEquals(1, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, recordsFor(paymentId).get(0).getProcessingResult());
        printSuccess("Handler ran once");
    }

    @Test
    @DisplayName("Each consumer group handles the same event independently")
    void testDifferentConsumerGroups() {
        printTestHeader("Different Consumer Groups");
        UUID eventId = UUID.randomUUID();
        String paymentId = "pay-" + UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, "attribution",
            calls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, "reporting",
            calls::incrementAndGet));

        assertEquals(2, calls.get());
        assertEquals(2, recordsFor(paymentId).size());
    }

    @Test
    @DisplayName("A permanently invalid event is recorded as REJECTED and not retried")
    void testPermanentFailure_RecordedAsRejected() {
        printTestHeader("Permanent Failure");
        UUID eventId = UUID.randomUUID();
        String paymentId = "pay-" + UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId,
            CONSUMER_GROUP, () -> {
                calls.incrementAndGet();
                throw TipLedgerException.of(ErrorKind.SEGMENT_NOT_FOUND, "No segment covers the tip");
            });
        boolean redelivered = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId,
            CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(processed);
        assertFalse(redelivered);
        assertEquals(1, calls.get());
        ProcessedEventEntity record = recordsFor(paymentId).get(0);
        assertEquals(ProcessedEvent.ProcessingResult.REJECTED, record.getProcessingResult());
        assertTrue(record.getErrorMessage().startsWith("SEGMENT_NOT_FOUND"));
        printSuccess("Rejected event acknowledged once");
    }

    @Test
    @DisplayName("A transient failure is rethrown and leaves no record so redelivery retries it")
    void testTransientFailure_Rethrown() {
        printTestHeader("Transient Failure");
        UUID eventId = UUID.randomUUID();
        String paymentId = "pay-" + UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP,
                () -> {
                    throw TipLedgerException.of(ErrorKind.BUSY, "Account locked");
                }));
        assertEquals(ErrorKind.BUSY, e.getKind());
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP,
            calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Skipped events are recorded without running anything")
    void testSkipEvent() {
        printTestHeader("Skip Event");
        UUID eventId = UUID.randomUUID();
        String paymentId = "pay-" + UUID.randomUUID();

        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP, "No tip on payment");
        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, paymentId, CONSUMER_GROUP, "No tip on payment");

        List<ProcessedEventEntity> records = recordsFor(paymentId);
        assertEquals(1, records.size());
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, records.get(0).getProcessingResult());
    }
}
