package com.flagship.invoice_ledger.invoice;

import java.time.LocalDate;

/**
 * Status as shown to users. OVERDUE is derived at read time from the due date.
 */
public enum InvoiceDisplayStatus {
    DRAFT,
    SENT,
    VIEWED,
    PAID,
    OVERDUE;

    public static InvoiceDisplayStatus of(InvoiceStatus status, LocalDate dueDate, LocalDate today) {
        if (status != InvoiceStatus.PAID && dueDate.isBefore(today)) {
            return OVERDUE;
        }
        return valueOf(status.name());
    }
}
