package com.flagship.invoice_ledger.payment;

public enum PaymentMethod {
    CASH,
    CHECK,
    BANK_TRANSFER,
    CREDIT_CARD,
    PAYPAL,
    STRIPE,
    OTHER
}
