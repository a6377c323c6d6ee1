package com.flagship.invoice_ledger.exception;

public class InvalidDiscountException extends LedgerException {

    public InvalidDiscountException(String message) {
        super(ErrorKind.INVALID_DISCOUNT, message);
    }
}
