package com.flagship.invoice_ledger.exception;

/**
 * A lock could not be acquired in time or a concurrent writer won the race.
 * No partial effects were committed; the caller may retry.
 */
public class ContentionException extends LedgerException {

    public ContentionException(String operation, Throwable cause) {
        super(ErrorKind.CONTENTION, "Concurrent update conflict during " + operation + ", retry the request", cause);
    }
}
