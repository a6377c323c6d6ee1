package com.flagship.invoice_ledger.exception;

import java.util.UUID;

/**
 * Raised for any attempt to change, delete or re-status a PAID invoice.
 */
public class InvoiceImmutableException extends LedgerException {

    public InvoiceImmutableException(UUID invoiceId, String action) {
        super(ErrorKind.INVOICE_IMMUTABLE,
                String.format("Invoice %s is paid and cannot be %s", invoiceId, action));
    }
}
