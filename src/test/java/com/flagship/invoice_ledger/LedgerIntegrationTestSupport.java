package com.flagship.invoice_ledger;

import com.flagship.invoice_ledger.client.ClientService;
import com.flagship.invoice_ledger.client.dto.CreateClientRequest;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoice_ledger.invoice.dto.LineItemRequest;
import com.flagship.invoice_ledger.ledger.LedgerService;
import com.flagship.invoice_ledger.payment.PaymentMethod;
import com.flagship.invoice_ledger.payment.dto.RecordPaymentRequest;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import com.flagship.invoice_ledger.subscription.SubscriptionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Shared PostgreSQL container and fixtures for integration tests.
 *
 * The container is started once per JVM so that cached Spring contexts keep a
 * live database. Every test works under fresh owner ids, so tests never see
 * each other's rows. Kafka and the outbox publisher are off unless a subclass
 * turns them on.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class LedgerIntegrationTestSupport {

    protected static final LocalDate ISSUE_DATE = LocalDate.now().minusDays(1);
    protected static final LocalDate DUE_DATE = LocalDate.now().plusDays(30);

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("invoice_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No Kafka or Redis behind these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("spring.data.redis.connect-timeout", () -> "200ms");
    }

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected SubscriptionService subscriptionService;

    @Autowired
    protected ClientService clientService;

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    /**
     * A new account on the FREE plan (5 invoices, 5 clients).
     */
    protected UUID newOwner() {
        UUID ownerId = UUID.randomUUID();
        subscriptionService.provision(ownerId);
        return ownerId;
    }

    protected UUID newOwner(SubscriptionPlan plan) {
        UUID ownerId = newOwner();
        subscriptionService.updatePlan(ownerId, plan);
        return ownerId;
    }

    protected UUID newClient(UUID ownerId) {
        return clientService.createClient(ownerId, CreateClientRequest.builder()
                .name("Northwind Studio")
                .email("billing@northwind.test")
                .build()).getId();
    }

    protected static LineItemRequest item(String description, String quantity, String rate) {
        return new LineItemRequest(description, new BigDecimal(quantity), new BigDecimal(rate));
    }

    /**
     * Two lines (2 x 100.00, 1 x 50.00) at 10% tax: subtotal 250.00, tax 25.00, total 275.00.
     */
    protected static CreateInvoiceRequest workedExample(UUID clientId) {
        return CreateInvoiceRequest.builder()
                .clientId(clientId)
                .issueDate(ISSUE_DATE)
                .dueDate(DUE_DATE)
                .currency("USD")
                .taxRate(new BigDecimal("10"))
                .discountAmount(BigDecimal.ZERO)
                .items(List.of(item("Design work", "2", "100.00"), item("Hosting", "1", "50.00")))
                .build();
    }

    protected Invoice createWorkedExample(UUID ownerId, UUID clientId) {
        return ledgerService.createInvoice(ownerId, workedExample(clientId));
    }

    protected static RecordPaymentRequest payment(String amount) {
        return RecordPaymentRequest.builder()
                .amount(new BigDecimal(amount))
                .method(PaymentMethod.BANK_TRANSFER)
                .build();
    }
}
