package com.flagship.invoice_ledger.subscription;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Resources gated by a subscription counter. Column names are fixed here and
 * never taken from input.
 */
@Getter
@RequiredArgsConstructor
public enum QuotaResource {
    INVOICE("Invoice", "invoices_sent", "invoice_limit"),
    CLIENT("Client", "clients_created", "client_limit");

    private final String label;
    private final String counterColumn;
    private final String limitColumn;
}
