package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.exception.InvalidRequestException;
import com.flagship.invoice_ledger.exception.InvoiceImmutableException;
import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoice_ledger.invoice.dto.LineItemRequest;
import com.flagship.invoice_ledger.invoice.dto.UpdateInvoiceRequest;
import com.flagship.invoice_ledger.payment.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Creates and edits invoice content: line items, pricing, dates, client and notes.
 *
 * Runs inside the caller's transaction. Status changes are not made here;
 * they belong to {@link InvoiceStateMachine}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceEditor {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceNumberService numberService;
    private final TotalsCalculator totalsCalculator;

    /**
     * Prices and persists a new DRAFT invoice. Quota must already be reserved.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceEntity createDraft(UUID ownerId, CreateInvoiceRequest request) {
        checkDates(request.getIssueDate(), request.getDueDate());
        List<LineItem> items = toLineItems(request.getItems());
        InvoiceTotals totals = totalsCalculator.calculate(items, request.getDiscountAmount(), request.getTaxRate());
        CurrencyCode currency = CurrencyCode.parse(request.getCurrency());

        String number = numberService.assignNumber(ownerId);
        InvoiceEntity invoice = InvoiceEntity.draft(
            ownerId,
            request.getClientId(),
            number,
            request.getIssueDate(),
            request.getDueDate(),
            currency,
            request.getNotes(),
            request.getTerms(),
            items,
            totals
        );
        return invoiceRepository.save(invoice);
    }

    /**
     * Applies a partial update to a locked, non-paid invoice and reprices it when
     * items, discount or tax rate change. Client ownership is checked by the caller.
     *
     * @param paymentsOnRecord whether any pending or completed payment exists; the
     *                         currency is fixed once one does
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyChanges(InvoiceEntity invoice, UpdateInvoiceRequest changes, boolean paymentsOnRecord) {
        if (invoice.isPaid()) {
            throw new InvoiceImmutableException(invoice.getId(), "updated");
        }

        if (changes.getClientId() != null) {
            invoice.reassignClient(changes.getClientId());
        }

        if (changes.getIssueDate() != null || changes.getDueDate() != null) {
            LocalDate issueDate = changes.getIssueDate() != null ? changes.getIssueDate() : invoice.getIssueDate();
            LocalDate dueDate = changes.getDueDate() != null ? changes.getDueDate() : invoice.getDueDate();
            checkDates(issueDate, dueDate);
            invoice.reschedule(issueDate, dueDate);
        }

        if (changes.getCurrency() != null) {
            CurrencyCode currency = CurrencyCode.parse(changes.getCurrency());
            if (currency != invoice.getCurrency() && (paymentsOnRecord || invoice.getAmountPaid().signum() > 0)) {
                throw new InvalidRequestException("Currency cannot change once payments are recorded");
            }
            invoice.changeCurrency(currency);
        }

        if (changes.getNotes() != null || changes.getTerms() != null) {
            invoice.updateNotes(
                changes.getNotes() != null ? changes.getNotes() : invoice.getNotes(),
                changes.getTerms() != null ? changes.getTerms() : invoice.getTerms());
        }

        if (changes.changesPricing()) {
            List<LineItem> items = changes.getItems() != null
                ? toLineItems(changes.getItems())
                : invoice.lineItems();
            InvoiceTotals totals = totalsCalculator.calculate(
                items,
                changes.getDiscountAmount() != null ? changes.getDiscountAmount() : invoice.getDiscountAmount(),
                changes.getTaxRate() != null ? changes.getTaxRate() : invoice.getTaxRatePercent());
            invoice.reprice(items, totals);
            log.debug("Invoice repriced: invoiceId={}, total={}, amountDue={}",
                invoice.getId(), invoice.getTotal(), invoice.getAmountDue());
        }
    }

    private static void checkDates(LocalDate issueDate, LocalDate dueDate) {
        if (dueDate.isBefore(issueDate)) {
            throw new InvalidRequestException("Due date cannot be before the issue date");
        }
    }

    private static List<LineItem> toLineItems(List<LineItemRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
            .map(request -> request == null ? null : request.toLineItem())
            .toList();
    }
}
