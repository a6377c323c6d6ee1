package com.flagship.invoice_ledger.exception;

public class InvalidStatusTransitionException extends LedgerException {

    public InvalidStatusTransitionException(String subject, Enum<?> from, Enum<?> to) {
        super(ErrorKind.INVALID_STATUS_TRANSITION,
                String.format("%s cannot transition from %s to %s", subject, from, to));
    }
}
