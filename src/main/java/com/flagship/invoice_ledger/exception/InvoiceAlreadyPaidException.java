package com.flagship.invoice_ledger.exception;

import java.util.UUID;

public class InvoiceAlreadyPaidException extends LedgerException {

    public InvoiceAlreadyPaidException(UUID invoiceId) {
        super(ErrorKind.INVOICE_ALREADY_PAID, "Invoice " + invoiceId + " is already paid");
    }
}
