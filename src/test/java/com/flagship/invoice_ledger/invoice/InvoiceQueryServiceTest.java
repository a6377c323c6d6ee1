package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.LedgerIntegrationTestSupport;
import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceQueryServiceTest extends LedgerIntegrationTestSupport {

    private static final LocalDate LAST_YEAR = LocalDate.now().minusYears(1);

    @Autowired
    private InvoiceQueryService queryService;

    private UUID ownerId;
    private UUID clientId;

    @BeforeEach
    void setUp() {
        ownerId = newOwner(SubscriptionPlan.BASIC);
        clientId = newClient(ownerId);
    }

    private Invoice createInvoice(UUID client, LocalDate issueDate, LocalDate dueDate, String rate) {
        return ledgerService.createInvoice(ownerId, CreateInvoiceRequest.builder()
                .clientId(client)
                .issueDate(issueDate)
                .dueDate(dueDate)
                .items(List.of(item("Consulting", "1", rate)))
                .build());
    }

    @Test
    @DisplayName("Listing filters by status, client and issue-date range")
    void testListInvoices_Filters() {
        UUID otherClient = newClient(ownerId);
        Invoice oldDraft = createInvoice(clientId, LAST_YEAR, LAST_YEAR.plusDays(30), "100");
        Invoice sent = createInvoice(clientId, ISSUE_DATE, DUE_DATE, "200");
        Invoice otherClientInvoice = createInvoice(otherClient, ISSUE_DATE, DUE_DATE, "300");
        ledgerService.sendInvoice(sent.getId(), ownerId);

        assertEquals(3, queryService.listInvoices(ownerId, InvoiceFilter.none()).size());

        List<Invoice> sentOnly = queryService.listInvoices(ownerId,
                InvoiceFilter.builder().status(InvoiceStatus.SENT).build());
        assertEquals(List.of(sent.getId()), sentOnly.stream().map(Invoice::getId).toList());

        List<Invoice> forOtherClient = queryService.listInvoices(ownerId,
                InvoiceFilter.builder().clientId(otherClient).build());
        assertEquals(List.of(otherClientInvoice.getId()), forOtherClient.stream().map(Invoice::getId).toList());

        List<Invoice> lastYear = queryService.listInvoices(ownerId, InvoiceFilter.builder()
                .issuedFrom(LAST_YEAR)
                .issuedTo(LAST_YEAR)
                .build());
        assertEquals(List.of(oldDraft.getId()), lastYear.stream().map(Invoice::getId).toList());

        assertTrue(queryService.listInvoices(newOwner(), InvoiceFilter.none()).isEmpty());
    }

    @Test
    @DisplayName("Unpaid invoices past due are overdue; paid ones never are")
    void testOverdueInvoices() {
        Invoice overdue = createInvoice(clientId, LAST_YEAR, LAST_YEAR.plusDays(30), "100");
        Invoice paidLate = createInvoice(clientId, LAST_YEAR, LAST_YEAR.plusDays(30), "50");
        createInvoice(clientId, ISSUE_DATE, DUE_DATE, "75");
        ledgerService.applyPayment(paidLate.getId(), ownerId, payment("50.00"), null);

        List<Invoice> result = queryService.overdueInvoices(ownerId);

        assertEquals(List.of(overdue.getId()), result.stream().map(Invoice::getId).toList());
        assertTrue(result.get(0).isOverdue(LocalDate.now()));
        assertEquals(InvoiceDisplayStatus.OVERDUE, result.get(0).displayStatus(LocalDate.now()));
        assertEquals(InvoiceStatus.DRAFT, result.get(0).getStatus());
    }

    @Test
    @DisplayName("Stats sum invoiced, paid and outstanding amounts")
    void testInvoiceStats() {
        Invoice a = createInvoice(clientId, ISSUE_DATE, DUE_DATE, "100");
        Invoice b = createInvoice(clientId, ISSUE_DATE, DUE_DATE, "200");
        createInvoice(clientId, LAST_YEAR, LAST_YEAR.plusDays(30), "300");
        ledgerService.applyPayment(a.getId(), ownerId, payment("100.00"), null);
        ledgerService.sendInvoice(b.getId(), ownerId);
        ledgerService.applyPayment(b.getId(), ownerId, payment("50.00"), null);

        InvoiceStats stats = queryService.invoiceStats(ownerId);
        printOutput("Stats", stats);

        assertEquals(3, stats.getTotalInvoices());
        assertEquals(1L, stats.getCountByStatus().get(InvoiceStatus.PAID));
        assertEquals(1L, stats.getCountByStatus().get(InvoiceStatus.SENT));
        assertEquals(1L, stats.getCountByStatus().get(InvoiceStatus.DRAFT));
        assertEquals(0L, stats.getCountByStatus().get(InvoiceStatus.VIEWED));
        assertEquals(1, stats.getOverdueCount());
        assertEquals(new BigDecimal("600.00"), stats.getTotalInvoiced());
        assertEquals(new BigDecimal("150.00"), stats.getTotalPaid());
        assertEquals(new BigDecimal("450.00"), stats.getTotalOutstanding());
    }

    @Test
    @DisplayName("A found invoice carries its line items in order")
    void testFindInvoice_WithItems() {
        Invoice created = createWorkedExample(ownerId, clientId);

        Invoice found = queryService.findInvoice(created.getId(), ownerId);

        assertEquals(created.getInvoiceNumber(), found.getInvoiceNumber());
        assertEquals("Design work", found.getItems().get(0).getDescription());
        assertEquals("Hosting", found.getItems().get(1).getDescription());
        assertEquals(new BigDecimal("200.00"), found.getItems().get(0).getAmount());
    }
}
