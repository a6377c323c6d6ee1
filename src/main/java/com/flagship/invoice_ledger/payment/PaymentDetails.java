package com.flagship.invoice_ledger.payment;

import lombok.Value;

import java.time.LocalDate;

/**
 * Descriptive fields of a payment that carry no money semantics.
 */
@Value
public class PaymentDetails {
    PaymentMethod method;
    LocalDate paymentDate;
    String referenceNumber;
    String notes;
}
