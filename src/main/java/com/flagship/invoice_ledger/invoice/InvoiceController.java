package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoice_ledger.invoice.dto.InvoiceResponse;
import com.flagship.invoice_ledger.invoice.dto.LineItemRequest;
import com.flagship.invoice_ledger.invoice.dto.StatusChangeRequest;
import com.flagship.invoice_ledger.invoice.dto.TotalsPreviewRequest;
import com.flagship.invoice_ledger.invoice.dto.TotalsResponse;
import com.flagship.invoice_ledger.invoice.dto.UpdateInvoiceRequest;
import com.flagship.invoice_ledger.ledger.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for invoices.
 *
 * Every endpoint except the public view is scoped to the account in the
 * X-Account-Id header. Invoices of other accounts answer 404.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private static final String ACCOUNT_HEADER = "X-Account-Id";

    private final LedgerService ledgerService;
    private final InvoiceQueryService queryService;
    private final Clock clock;

    @PostMapping("/preview")
    public ResponseEntity<TotalsResponse> previewTotals(@Valid @RequestBody TotalsPreviewRequest request) {
        List<LineItem> items = request.getItems() == null
            ? List.of()
            : request.getItems().stream().map(LineItemRequest::toLineItem).toList();
        InvoiceTotals totals = ledgerService.previewTotals(items, request.getDiscountAmount(), request.getTaxRate());
        return ResponseEntity.ok(TotalsResponse.from(totals));
    }

    @PostMapping
    public ResponseEntity<InvoiceResponse> createInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @Valid @RequestBody CreateInvoiceRequest request) {
        log.info("Received invoice creation request: clientId={}, items={}",
            request.getClientId(), request.getItems() == null ? 0 : request.getItems().size());
        Invoice invoice = ledgerService.createInvoice(ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(respond(invoice));
    }

    @GetMapping
    public ResponseEntity<List<InvoiceResponse>> listInvoices(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @RequestParam(value = "status", required = false) InvoiceStatus status,
            @RequestParam(value = "client_id", required = false) UUID clientId,
            @RequestParam(value = "issued_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate issuedFrom,
            @RequestParam(value = "issued_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate issuedTo) {
        InvoiceFilter filter = InvoiceFilter.builder()
            .status(status)
            .clientId(clientId)
            .issuedFrom(issuedFrom)
            .issuedTo(issuedTo)
            .build();
        return ResponseEntity.ok(respond(queryService.listInvoices(ownerId, filter)));
    }

    @GetMapping("/stats")
    public ResponseEntity<InvoiceStats> invoiceStats(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(queryService.invoiceStats(ownerId));
    }

    @GetMapping("/overdue")
    public ResponseEntity<List<InvoiceResponse>> overdueInvoices(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(respond(queryService.overdueInvoices(ownerId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> getInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(respond(queryService.findInvoice(id, ownerId)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<InvoiceResponse> updateInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateInvoiceRequest request) {
        return ResponseEntity.ok(respond(ledgerService.updateInvoice(id, ownerId, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        ledgerService.deleteInvoice(id, ownerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<InvoiceResponse> changeStatus(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(respond(ledgerService.transitionStatus(id, ownerId, request.getStatus())));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<InvoiceResponse> sendInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(respond(ledgerService.sendInvoice(id, ownerId)));
    }

    @PostMapping("/{id}/mark-paid")
    public ResponseEntity<InvoiceResponse> markPaid(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(respond(ledgerService.markPaid(id, ownerId)));
    }

    /**
     * Public link a client opens. No account header; records the first view.
     */
    @GetMapping("/{id}/view")
    public ResponseEntity<InvoiceResponse> viewInvoice(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(respond(ledgerService.markViewed(id)));
    }

    private InvoiceResponse respond(Invoice invoice) {
        return InvoiceResponse.from(invoice, LocalDate.now(clock));
    }

    private List<InvoiceResponse> respond(List<Invoice> invoices) {
        LocalDate today = LocalDate.now(clock);
        return invoices.stream().map(invoice -> InvoiceResponse.from(invoice, today)).toList();
    }
}
