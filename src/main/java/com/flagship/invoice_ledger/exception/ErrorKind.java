package com.flagship.invoice_ledger.exception;

/**
 * Closed set of failure kinds a ledger operation can report.
 *
 * Every kind except CONTENTION describes a deterministic outcome: retrying the
 * same call against the same state yields the same error.
 */
public enum ErrorKind {
    INVALID_LINE_ITEM,
    INVALID_DISCOUNT,
    INVALID_REQUEST,
    INVALID_STATUS_TRANSITION,
    INVOICE_IMMUTABLE,
    INVOICE_ALREADY_PAID,
    PAYMENT_EXCEEDS_AMOUNT_DUE,
    PAYMENT_IMMUTABLE,
    QUOTA_EXCEEDED,
    NO_SUBSCRIPTION,
    NOT_FOUND,
    CONTENTION;

    public boolean isRetryable() {
        return this == CONTENTION;
    }
}
