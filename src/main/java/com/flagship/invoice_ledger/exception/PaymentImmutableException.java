package com.flagship.invoice_ledger.exception;

import java.util.UUID;

public class PaymentImmutableException extends LedgerException {

    public PaymentImmutableException(UUID paymentId) {
        super(ErrorKind.PAYMENT_IMMUTABLE,
                "Payment " + paymentId + " is completed and cannot be modified or deleted");
    }
}
