package com.flagship.invoice_ledger.exception;

/**
 * Raised when a record does not exist or is not visible to the caller.
 * The two cases are reported the same way.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String resourceType, Object id) {
        super(ErrorKind.NOT_FOUND, resourceType + " not found: " + id);
    }
}
