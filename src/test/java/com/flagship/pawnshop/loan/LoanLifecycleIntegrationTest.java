package com.flagship.pawnshop.loan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pawnshop.loan.event.LoanEvent;
import com.flagship.pawnshop.loan.event.LoanOriginatedEvent;
import com.flagship.pawnshop.loan.event.LoanPaymentRecordedEvent;
import com.flagship.pawnshop.outbox.OutboxEvent;
import com.flagship.pawnshop.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end loan lifecycle over HTTP against PostgreSQL and Redis.
 *
 * These tests verify:
 * - Guarded endpoints answer 401 without a session and 403 for a missing permission
 * - A payment covering the balance completes the loan and redeems the item in one transaction
 * - Rejected operations leave the loan untouched
 * - A retried payment with the same Idempotency-Key is not posted twice
 * - Every committed lifecycle change leaves exactly one outbox event
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class LoanLifecycleIntegrationTest {

    private static final String ADMIN_PASSWORD = "admin-password-1";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pawnshop_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("pawnshop.bootstrap.admin-password", () -> ADMIN_PASSWORD);
        registry.add("pawnshop.security.jwt-secret", () -> "integration-test-secret-integration-test-secret");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OutboxService outboxService;

    private String adminToken;
    private UUID branchId;
    private UUID customerId;

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

    @BeforeEach
    void setUp() throws Exception {
        adminToken = login("admin", ADMIN_PASSWORD);
        branchId = id(call(post("/api/v1/branches"), adminToken,
            Map.of("name", "Branch " + suffix()), 201));

        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("first_name", "Grace");
        customer.put("last_name", "Hopper");
        customer.put("phone", "555-" + suffix());
        customerId = id(call(post("/api/v1/customers"), adminToken, customer, 201));
    }

    // Helpers

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private String login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("username", username, "password", password))))
            .andExpect(status().isOk())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("access_token").asText();
    }

    private JsonNode call(MockHttpServletRequestBuilder request, String token, Object body, int expectedStatus)
            throws Exception {
        if (token != null) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        if (body != null) {
            request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
        }
        MvcResult result = mockMvc.perform(request).andReturn();
        String content = result.getResponse().getContentAsString();
        assertEquals(expectedStatus, result.getResponse().getStatus(), content);
        return content.isEmpty() ? null : objectMapper.readTree(content);
    }

    private static UUID id(JsonNode node) {
        return UUID.fromString(node.get("id").asText());
    }

    private UUID createItem() throws Exception {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("name", "Gold watch");
        item.put("category", "WATCHES");
        item.put("appraised_value", 1500);
        item.put("loan_value", 1000);
        item.put("branch_id", branchId);
        item.put("customer_id", customerId);
        return id(call(post("/api/v1/inventory"), adminToken, item, 201));
    }

    private UUID createLoan(UUID itemId, int principal, int rate) throws Exception {
        Map<String, Object> loan = new LinkedHashMap<>();
        loan.put("customer_id", customerId);
        loan.put("item_id", itemId);
        loan.put("loan_amount", principal);
        loan.put("interest_rate", rate);
        loan.put("term_days", 30);
        loan.put("start_date", LocalDate.now().toString());
        loan.put("status", "ACTIVE");
        return id(call(post("/api/v1/loans"), adminToken, loan, 201));
    }

    private String staffToken() throws Exception {
        JsonNode roles = call(get("/api/v1/users/roles"), adminToken, null, 200);
        String staffRoleId = null;
        for (JsonNode role : roles) {
            if ("staff".equals(role.get("name").asText())) {
                staffRoleId = role.get("id").asText();
            }
        }
        assertNotNull(staffRoleId, "staff role is seeded by the schema migration");

        String username = "clerk-" + suffix();
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("username", username);
        user.put("email", username + "@pawnshop.local");
        user.put("password", "clerk-password");
        user.put("role_id", staffRoleId);
        call(post("/api/v1/users"), adminToken, user, 201);

        return login(username, "clerk-password");
    }

    private static Map<String, Object> payment(int amount) {
        return Map.of("amount", amount, "payment_method", "CASH");
    }

    // Access control

    @Test
    @DisplayName("Guarded endpoints answer 401 without a session")
    void missingSessionIsUnauthorized() throws Exception {
        printTestHeader("No Session");

        mockMvc.perform(get("/api/v1/loans"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(get("/api/v1/loans").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
            .andExpect(status().isUnauthorized());

        printSuccess("Requests without a valid token are rejected with 401");
    }

    @Test
    @DisplayName("A staff user lacks manage_branches and gets 403")
    void staffCannotManageBranches() throws Exception {
        printTestHeader("Missing Permission");

        String staffToken = staffToken();
        JsonNode denied = call(post("/api/v1/branches"), staffToken, Map.of("name", "Nope"), 403);
        printOutput("Message", denied.get("message").asText());

        assertEquals("Missing required permission: manage_branches", denied.get("message").asText());
        call(get("/api/v1/loans"), staffToken, null, 200);

        printSuccess("Permission tokens are enforced per role");
    }

    @Test
    @DisplayName("A staff user cannot default a loan and the loan is left as it was")
    void staffCannotDefaultLoan() throws Exception {
        UUID itemId = createItem();
        UUID loanId = createLoan(itemId, 1000, 5);

        JsonNode denied = call(put("/api/v1/loans/" + loanId + "/default"), staffToken(),
            Map.of("reason", "no contact"), 403);

        assertEquals("Forbidden", denied.get("error").asText());
        assertEquals("Missing required permission: approve_loans", denied.get("message").asText());
        assertEquals("ACTIVE", call(get("/api/v1/loans/" + loanId), adminToken, null, 200)
            .get("status").asText());
        assertEquals("PAWNED", call(get("/api/v1/inventory/" + itemId), adminToken, null, 200)
            .get("status").asText());
    }

    @Test
    void unknownLoanIsNotFound() throws Exception {
        JsonNode error = call(get("/api/v1/loans/" + UUID.randomUUID()), adminToken, null, 404);

        assertEquals("Not Found", error.get("error").asText());
    }

    @Test
    void overdueFilterSplitsLoansByDueDate() throws Exception {
        UUID loanId = createLoan(createItem(), 500, 10);

        JsonNode current = call(get("/api/v1/loans?is_overdue=false&customer_id=" + customerId), adminToken, null, 200);
        JsonNode overdue = call(get("/api/v1/loans?is_overdue=true&customer_id=" + customerId), adminToken, null, 200);

        assertEquals(1, current.size());
        assertEquals(loanId.toString(), current.get(0).get("id").asText());
        assertEquals(0, overdue.size());
    }

    // Lifecycle

    @Test
    @DisplayName("Paying 1050 on 1000 at 5% completes the loan and redeems the item")
    void fullPaymentCompletesLoan() throws Exception {
        printTestHeader("Payment Completes Loan");

        UUID itemId = createItem();
        UUID loanId = createLoan(itemId, 1000, 5);

        JsonNode pawned = call(get("/api/v1/inventory/" + itemId), adminToken, null, 200);
        assertEquals("PAWNED", pawned.get("status").asText());

        call(post("/api/v1/loans/" + loanId + "/payments"), adminToken, payment(1050), 201);

        JsonNode loan = call(get("/api/v1/loans/" + loanId), adminToken, null, 200);
        printOutput("Loan", loan);
        assertEquals("COMPLETED", loan.get("status").asText());
        assertEquals(0, loan.get("remaining_balance").decimalValue().signum());
        assertEquals(1, loan.get("payments").size());

        JsonNode item = call(get("/api/v1/inventory/" + itemId), adminToken, null, 200);
        assertEquals("REDEEMED", item.get("status").asText());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(LoanEvent.AGGREGATE_TYPE, loanId);
        assertEquals(List.of(LoanOriginatedEvent.EVENT_TYPE, LoanPaymentRecordedEvent.EVENT_TYPE),
            events.stream().map(OutboxEvent::getEventType).toList());

        printSuccess("Loan completed, item redeemed, two events in the outbox");
    }

    @Test
    @DisplayName("A partial payment leaves the status and reduces the balance")
    void partialPayment() throws Exception {
        UUID loanId = createLoan(createItem(), 500, 10);

        JsonNode posted = call(post("/api/v1/loans/" + loanId + "/payments"), adminToken, payment(200), 201);

        assertEquals(loanId.toString(), posted.get("id").asText());
        assertEquals("ACTIVE", posted.get("status").asText());
        assertEquals(0, posted.get("remaining_balance").decimalValue().compareTo(new BigDecimal("350")));
        assertEquals(0, posted.get("total_paid").decimalValue().compareTo(new BigDecimal("200")));
        assertFalse(posted.get("is_overdue").asBoolean());
        assertEquals(0, posted.get("payment").get("amount").decimalValue().compareTo(new BigDecimal("200")));

        JsonNode loan = call(get("/api/v1/loans/" + loanId), adminToken, null, 200);
        assertEquals("ACTIVE", loan.get("status").asText());
        assertEquals(0, loan.get("remaining_balance").decimalValue().compareTo(new BigDecimal("350")));
    }

    @Test
    @DisplayName("A payment on a completed loan is refused and changes nothing")
    void paymentOnCompletedLoanIsRejected() throws Exception {
        printTestHeader("Terminal Loan");

        UUID loanId = createLoan(createItem(), 1000, 5);
        call(post("/api/v1/loans/" + loanId + "/payments"), adminToken, payment(1050), 201);

        JsonNode error = call(post("/api/v1/loans/" + loanId + "/payments"), adminToken, payment(10), 400);
        printOutput("Error", error);
        assertEquals("COMPLETED", error.get("details").get("current_status").asText());

        JsonNode loan = call(get("/api/v1/loans/" + loanId), adminToken, null, 200);
        assertEquals(1, loan.get("payments").size());
        assertEquals(2, outboxService.getEventsForAggregate(LoanEvent.AGGREGATE_TYPE, loanId).size());

        printSuccess("Terminal loan left untouched");
    }

    @Test
    @DisplayName("Redeeming with less than the balance is a 422 and writes nothing")
    void redemptionShortfall() throws Exception {
        UUID itemId = createItem();
        UUID loanId = createLoan(itemId, 1000, 5);

        JsonNode error = call(put("/api/v1/loans/" + loanId + "/redeem"), adminToken,
            Map.of("payment", payment(500)), 422);

        assertEquals("redemption_covers_balance", error.get("details").get("rule").asText());
        JsonNode loan = call(get("/api/v1/loans/" + loanId), adminToken, null, 200);
        assertEquals("ACTIVE", loan.get("status").asText());
        assertEquals(0, loan.get("payments").size());
        assertEquals("PAWNED", call(get("/api/v1/inventory/" + itemId), adminToken, null, 200)
            .get("status").asText());
    }

    @Test
    @DisplayName("Defaulting a loan forfeits the item")
    void defaultForfeitsItem() throws Exception {
        UUID itemId = createItem();
        UUID loanId = createLoan(itemId, 1000, 5);

        JsonNode loan = call(put("/api/v1/loans/" + loanId + "/default"), adminToken,
            Map.of("reason", "no contact"), 200);

        assertEquals("DEFAULTED", loan.get("status").asText());
        assertEquals("DEFAULTED", call(get("/api/v1/inventory/" + itemId), adminToken, null, 200)
            .get("status").asText());
    }

    @Test
    @DisplayName("The same Idempotency-Key posts a payment only once")
    void idempotentPayment() throws Exception {
        printTestHeader("Idempotent Payment");

        UUID loanId = createLoan(createItem(), 1000, 5);
        String key = "pay-" + UUID.randomUUID();

        MockHttpServletRequestBuilder first = post("/api/v1/loans/" + loanId + "/payments")
            .header("Idempotency-Key", key);
        JsonNode created = call(first, adminToken, payment(100), 201);

        MockHttpServletRequestBuilder retry = post("/api/v1/loans/" + loanId + "/payments")
            .header("Idempotency-Key", key);
        JsonNode replayed = call(retry, adminToken, payment(100), 200);

        String paymentId = created.get("payment").get("id").asText();
        printOutput("First payment", paymentId);
        printOutput("Replayed payment", replayed.get("payment").get("id").asText());
        assertEquals(paymentId, replayed.get("payment").get("id").asText());
        assertEquals(0, replayed.get("total_paid").decimalValue().compareTo(new BigDecimal("100")));

        JsonNode loan = call(get("/api/v1/loans/" + loanId), adminToken, null, 200);
        assertEquals(1, loan.get("payments").size());
        assertEquals(0, loan.get("total_paid").decimalValue().compareTo(new BigDecimal("100")));

        printSuccess("Retried payment returned the original");
    }

    @Test
    @DisplayName("An application asking more than the estimated value is a 422")
    void applicationAboveEstimatedValue() throws Exception {
        Map<String, Object> application = new LinkedHashMap<>();
        application.put("customer_id", customerId);
        application.put("branch_id", branchId);
        application.put("item_category", "JEWELRY");
        application.put("estimated_value", 1000);
        application.put("loan_amount", 1200);
        application.put("interest_rate", 5);
        application.put("term_months", 1);

        JsonNode error = call(post("/api/v1/applications"), adminToken, application, 422);

        assertEquals("loan_within_estimated_value", error.get("details").get("rule").asText());
    }
}
