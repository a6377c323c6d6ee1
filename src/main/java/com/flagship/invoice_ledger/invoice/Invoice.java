package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.payment.CurrencyCode;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only snapshot of an invoice, taken inside the transaction that loaded it.
 *
 * Services hand these out instead of entities so that callers never hold a
 * reference through which amountPaid or status could be changed.
 */
@Value
public class Invoice {
    UUID id;
    UUID ownerId;
    UUID clientId;
    String invoiceNumber;
    LocalDate issueDate;
    LocalDate dueDate;
    CurrencyCode currency;
    BigDecimal taxRatePercent;
    BigDecimal discountAmount;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal total;
    BigDecimal amountPaid;
    BigDecimal amountDue;
    InvoiceStatus status;
    Instant sentAt;
    Instant viewedAt;
    Instant paidAt;
    String notes;
    String terms;
    List<InvoiceLineItem> items;
    long version;
    Instant createdAt;
    Instant updatedAt;

    public InvoiceDisplayStatus displayStatus(LocalDate today) {
        return InvoiceDisplayStatus.of(status, dueDate, today);
    }

    public boolean isOverdue(LocalDate today) {
        return displayStatus(today) == InvoiceDisplayStatus.OVERDUE;
    }
}
