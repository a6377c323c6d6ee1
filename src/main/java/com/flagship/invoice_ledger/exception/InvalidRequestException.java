package com.flagship.invoice_ledger.exception;

public class InvalidRequestException extends LedgerException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
