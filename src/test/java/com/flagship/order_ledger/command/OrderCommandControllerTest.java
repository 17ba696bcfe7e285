package com.flagship.order_ledger.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.order_ledger.eventstore.EventStore;
import com.flagship.order_ledger.projection.OrderSummaryProjection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests for the command endpoints over H2.
 *
 * These tests verify:
 * - Create answers 201 with the new stream version
 * - The read model catches up after the command returns
 * - The same Idempotency-Key never creates a second order
 * - Domain errors map to 400, 402, 404 and 409
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class OrderCommandControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private EventStore eventStore;

    @Autowired
    private OrderSummaryProjection projection;

    private UUID customerId;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM order_events");
        jdbcTemplate.update("DELETE FROM order_summaries");
        jdbcTemplate.update("DELETE FROM command_receipts");
        customerId = UUID.randomUUID();
    }

    // Helper methods for test output
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

    private String createBody(String unitPrice) {
        return """
                {
                  "customer_id": "%s",
                  "currency": "USD",
                  "items": [{"product_id": "P1", "quantity": 2, "unit_price": %s}]
                }
                """.formatted(customerId, unitPrice);
    }

    private UUID createOrder(String unitPrice) throws Exception {
        String json = mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(unitPrice)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return UUID.fromString(objectMapper.readTree(json).get("order_id").asText());
    }

    @Test
    @DisplayName("Create returns 201; the summary is readable once the projection catches up")
    void testCreate_ThenReadAfterProjection() throws Exception {
        printTestHeader("Create Then Read");

        String json = mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody("10.00")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").exists())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.appended_events[0]").value("ORDER_CREATED"))
                .andReturn().getResponse().getContentAsString();
        UUID orderId = UUID.fromString(objectMapper.readTree(json).get("order_id").asText());
        printOutput("Order ID", orderId);

        // Automatic dispatch is off in tests, so the read model has not seen the order yet
        mockMvc.perform(get("/api/orders/{id}", orderId))
                .andExpect(status().isNotFound());

        projection.catchUp();

        String summaryJson = mockMvc.perform(get("/api/orders/{id}", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andExpect(jsonPath("$.item_count").value(1))
                .andExpect(jsonPath("$.version").value(1))
                .andReturn().getResponse().getContentAsString();

        JsonNode summary = objectMapper.readTree(summaryJson);
        printOutput("Summary", summary);
        assertEquals(0, new BigDecimal("20.00").compareTo(summary.get("total_amount").decimalValue()));

        printSuccess("Summary visible after catch-up");
    }

    @Test
    @DisplayName("Add, confirm and cancel return the resulting stream version")
    void testLifecycleEndpoints() throws Exception {
        printTestHeader("Lifecycle Endpoints");

        UUID orderId = createOrder("10.00");

        mockMvc.perform(post("/api/orders/{id}/items", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\": \"P2\", \"quantity\": 1, \"unit_price\": 5.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.appended_events[0]").value("ITEM_ADDED"));

        mockMvc.perform(post("/api/orders/{id}/confirm", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(3));

        // A repeated confirm is a no-op at the same version
        mockMvc.perform(post("/api/orders/{id}/confirm", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(3))
                .andExpect(jsonPath("$.appended_events").isEmpty());

        mockMvc.perform(post("/api/orders/{id}/items", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\": \"P3\", \"quantity\": 1, \"unit_price\": 1.00}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invariant Violation"));

        mockMvc.perform(post("/api/orders/{id}/cancel", orderId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"changed my mind\"}"))
                .andExpect(status().isConflict());

        printSuccess("Lifecycle enforced over HTTP");
    }

    @Test
    @DisplayName("Cancel without a body is accepted")
    void testCancel_NoBody() throws Exception {
        UUID orderId = createOrder("10.00");

        mockMvc.perform(post("/api/orders/{id}/cancel", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.appended_events[0]").value("ORDER_CANCELLED"));
    }

    @Test
    @DisplayName("Same Idempotency-Key twice returns the same order with 200")
    void testIdempotency_SameKeyTwice() throws Exception {
        printTestHeader("Idempotency: Same Key Twice");

        String key = UUID.randomUUID().toString();

        String first = mockMvc.perform(post("/api/orders")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody("10.00")))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(post("/api/orders")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody("10.00")))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        UUID firstId = UUID.fromString(objectMapper.readTree(first).get("order_id").asText());
        UUID secondId = UUID.fromString(objectMapper.readTree(second).get("order_id").asText());
        printOutput("First", firstId);
        printOutput("Second", secondId);

        assertEquals(firstId, secondId);
        assertEquals(1, eventStore.loadStream(firstId).size());

        printSuccess("One order, one event");
    }

    @Test
    @DisplayName("Concurrent requests with one Idempotency-Key create exactly one order")
    void testIdempotency_ConcurrentRequests() throws Exception {
        printTestHeader("Idempotency: Concurrent Requests");

        String key = UUID.randomUUID().toString();
        int numThreads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger createdCount = new AtomicInteger(0);
        AtomicInteger duplicateCount = new AtomicInteger(0);
        UUID[] orderIds = new UUID[numThreads];

        for (int i = 0; i < numThreads; i++) {
            final int index = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    MvcResult result = mockMvc.perform(post("/api/orders")
                                    .header("Idempotency-Key", key)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(createBody("10.00")))
                            .andReturn();
                    int status = result.getResponse().getStatus();
                    orderIds[index] = UUID.fromString(objectMapper.readTree(
                            result.getResponse().getContentAsString()).get("order_id").asText());
                    if (status == 201) {
                        createdCount.incrementAndGet();
                    } else if (status == 200) {
                        duplicateCount.incrementAndGet();
                    }
                } catch (Exception e) {
                    e.printStackTrace();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Created Responses (201)", createdCount.get());
        printOutput("Duplicate Responses (200)", duplicateCount.get());

        UUID expected = CreateOrderCommand.orderIdForKey(key);
        for (UUID orderId : orderIds) {
            assertEquals(expected, orderId);
        }
        assertEquals(1, createdCount.get());
        assertEquals(numThreads - 1, duplicateCount.get());
        assertEquals(1, eventStore.loadStream(expected).size());

        printSuccess("Exactly one order created");
    }

    @Test
    @DisplayName("Invalid input is rejected with 400")
    void testValidation() throws Exception {
        printTestHeader("Validation");

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customer_id": "%s", "currency": "USD", "items": []}
                                """.formatted(customerId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.items").exists());

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customer_id": "%s", "currency": "USD",
                                 "items": [{"product_id": "P1", "quantity": 0, "unit_price": 1.00}]}
                                """.formatted(customerId)))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customer_id": "%s", "currency": "XYZ",
                                 "items": [{"product_id": "P1", "quantity": 1, "unit_price": 1.00}]}
                                """.formatted(customerId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid currency code: XYZ"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        printSuccess("All rejected with 400");
    }

    @Test
    @DisplayName("A null item or a price with five decimal places is a 400, not a 500")
    void testItemEdgeCases_Rejected() throws Exception {
        printTestHeader("Item Edge Cases");

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customer_id": "%s", "currency": "USD", "items": [null]}
                                """.formatted(customerId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details['items[0]']").value("Item is required"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody("0.00333")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        assertTrue(eventStore.streamHeads().isEmpty());

        printSuccess("Rejected before anything was appended");
    }

    @Test
    @DisplayName("Lower-case currency codes parse the same under any default locale")
    void testCurrencyParsing_LocaleIndependent() throws Exception {
        printTestHeader("Currency Parsing - Locale");

        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            mockMvc.perform(post("/api/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"customer_id": "%s", "currency": "inr",
                                     "items": [{"product_id": "P1", "quantity": 1, "unit_price": 100}]}
                                    """.formatted(customerId)))
                    .andExpect(status().isCreated());
        } finally {
            Locale.setDefault(original);
        }

        printSuccess("'inr' accepted under a Turkish default locale");
    }

    @Test
    @DisplayName("Commands on an unknown order return 404")
    void testUnknownOrder() throws Exception {
        mockMvc.perform(post("/api/orders/{id}/confirm", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Order Not Found"));
    }

    @Test
    @DisplayName("A declined payment returns 402 and the order stays open")
    void testConfirm_PaymentDeclined() throws Exception {
        printTestHeader("Payment Declined");

        UUID orderId = createOrder("2000000.00");

        mockMvc.perform(post("/api/orders/{id}/confirm", orderId))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.details.decline_reason").exists());

        assertEquals(1, eventStore.loadStream(orderId).size());

        mockMvc.perform(post("/api/orders/{id}/cancel", orderId))
                .andExpect(status().isOk());

        printSuccess("Declined order could still be cancelled");
    }
}
