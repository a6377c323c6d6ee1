package com.flagship.invoice_ledger.exception;

public class InvalidLineItemException extends LedgerException {

    public InvalidLineItemException(String message) {
        super(ErrorKind.INVALID_LINE_ITEM, message);
    }
}
