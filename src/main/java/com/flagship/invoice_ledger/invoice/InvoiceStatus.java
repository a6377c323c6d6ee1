package com.flagship.invoice_ledger.invoice;

/**
 * Stored lifecycle status of an invoice.
 *
 * OVERDUE is not stored; see {@link InvoiceDisplayStatus}.
 */
public enum InvoiceStatus {
    /**
     * Being edited by the owner. Not visible to the client.
     */
    DRAFT,

    /**
     * Delivered to the client.
     */
    SENT,

    /**
     * Opened by the client at least once.
     */
    VIEWED,

    /**
     * Fully settled. Terminal: no further transitions or edits.
     */
    PAID;

    public boolean isTerminal() {
        return this == PAID;
    }
}
