package com.flagship.invoice_ledger.exception;

import java.math.BigDecimal;

public class PaymentExceedsAmountDueException extends LedgerException {

    public PaymentExceedsAmountDueException(BigDecimal amount, BigDecimal amountDue) {
        super(ErrorKind.PAYMENT_EXCEEDS_AMOUNT_DUE,
                String.format("Payment amount %s exceeds amount due %s",
                        amount.toPlainString(), amountDue.toPlainString()));
    }
}
