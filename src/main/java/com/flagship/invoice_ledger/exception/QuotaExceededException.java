package com.flagship.invoice_ledger.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends LedgerException {

    private final String resource;
    private final int limit;

    public QuotaExceededException(String resource, int limit) {
        super(ErrorKind.QUOTA_EXCEEDED,
                String.format("%s limit of %d reached for the current plan", resource, limit));
        this.resource = resource;
        this.limit = limit;
    }
}
