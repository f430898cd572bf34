package com.flagship.tip_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface: status codes, the snake_case wire format and error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class TipLedgerApiTest {

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
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID locationId;

    @BeforeEach
    void setUp() {
        locationId = UUID.randomUUID();
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

    private UUID registerEmployee(String name) throws Exception {
        Map<String, Object> body = Map.of(
            "location_id", locationId.toString(),
            "display_name", name,
            "role", "server");
        MvcResult result = mockMvc.perform(post("/api/employees")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.role").value("SERVER"))
            .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(json.get("id").asText());
    }

    private Map<String, Object> tipBody(String paymentId, UUID employeeId, long cents) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payment_id", paymentId);
        body.put("location_id", locationId.toString());
        body.put("amount_cents", cents);
        body.put("collected_at", "2024-05-01T20:00:00Z");
        body.put("employee_id", employeeId.toString());
        body.put("tender", "CASH");
        return body;
    }

    @Test
    @DisplayName("Recording a tip returns 201, resubmitting it returns 200 with the same transaction")
    void testRecordTipIdempotently() throws Exception {
        printTestHeader("Record Tip Idempotently");
        UUID server = registerEmployee("Sam");
        String paymentId = "pay-" + UUID.randomUUID();
        String body = objectMapper.writeValueAsString(tipBody(paymentId, server, 1250));

        MvcResult first = mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.duplicate").value(false))
            .andExpect(jsonPath("$.shares[0].share_cents").value(1250))
            .andReturn();
        MvcResult second = mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true))
            .andReturn();

        JsonNode firstJson = objectMapper.readTree(first.getResponse().getContentAsString());
        JsonNode secondJson = objectMapper.readTree(second.getResponse().getContentAsString());
        printOutput("First", firstJson);
        assertEquals(firstJson.get("transaction").get("id"), secondJson.get("transaction").get("id"));

        mockMvc.perform(get("/api/ledger/employees/{id}/balance", server))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance_cents").value(1250));
        printSuccess("Tip posted once");
    }

    @Test
    @DisplayName("A tip without a payment id is rejected with 400")
    void testMissingPaymentId() throws Exception {
        printTestHeader("Missing Payment Id");
        UUID server = registerEmployee("Sam");
        Map<String, Object> body = tipBody("ignored", server, 500);
        body.remove("payment_id");

        mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"))
            .andExpect(jsonPath("$.details.paymentId").exists());
    }

    @Test
    @DisplayName("A tip naming both an employee and a pool is rejected with 400")
    void testAmbiguousTarget() throws Exception {
        printTestHeader("Ambiguous Target");
        UUID server = registerEmployee("Sam");
        Map<String, Object> body = tipBody("pay-" + UUID.randomUUID(), server, 500);
        body.put("pool_id", UUID.randomUUID().toString());

        mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    @DisplayName("A co-owned table tip is split by the owners' percentages")
    void testOwnershipTip() throws Exception {
        printTestHeader("Ownership Tip");
        UUID first = registerEmployee("Sam");
        UUID second = registerEmployee("Sky");
        Map<String, Object> body = tipBody("pay-" + UUID.randomUUID(), first, 1000);
        body.remove("employee_id");
        body.put("owners", List.of(
            Map.of("employee_id", first.toString(), "percent", 70),
            Map.of("employee_id", second.toString(), "percent", 30)));

        mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.transaction.target_type").value("OWNERSHIP"))
            .andExpect(jsonPath("$.shares.length()").value(2));

        mockMvc.perform(get("/api/ledger/employees/{id}/balance", first))
            .andExpect(jsonPath("$.balance_cents").value(700));
        mockMvc.perform(get("/api/ledger/employees/{id}/balance", second))
            .andExpect(jsonPath("$.balance_cents").value(300));

        body.put("payment_id", "pay-" + UUID.randomUUID());
        body.put("owners", List.of(
            Map.of("employee_id", first.toString(), "percent", 70),
            Map.of("employee_id", second.toString(), "percent", 20)));
        mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isBadRequest());
        printSuccess("Owners credited 70/30; a 90% split was refused");
    }

    @Test
    @DisplayName("A tip for an unknown employee returns 404")
    void testUnknownEmployee() throws Exception {
        printTestHeader("Unknown Employee");

        mockMvc.perform(post("/api/tips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    tipBody("pay-" + UUID.randomUUID(), UUID.randomUUID(), 500))))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("UNKNOWN_EMPLOYEE"));
    }

    @Test
    @DisplayName("Adjustments require an Idempotency-Key header")
    void testAdjustmentRequiresKey() throws Exception {
        printTestHeader("Adjustment Requires Key");
        UUID server = registerEmployee("Sam");
        String body = objectMapper.writeValueAsString(Map.of("amount_cents", 300, "memo", "Drawer over"));

        mockMvc.perform(post("/api/ledger/employees/{id}/adjustments", server)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest());

        String key = "adj-" + UUID.randomUUID();
        mockMvc.perform(post("/api/ledger/employees/{id}/adjustments", server)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/ledger/employees/{id}/adjustments", server)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    @DisplayName("Unknown resources return 404")
    void testUnknownResources() throws Exception {
        printTestHeader("Unknown Resources");

        mockMvc.perform(get("/api/employees/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/pools/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/ledger/employees/{id}/balance", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }
}
