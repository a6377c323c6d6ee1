package com.flagship.invoice_ledger.exception;

import lombok.Getter;

/**
 * Base type for every typed failure raised by the ledger.
 * Callers branch on {@link #getKind()} rather than on message text.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
