package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.payment.Payment;
import lombok.Value;

/**
 * Outcome of applying a payment: the payment, the invoice after it, and whether
 * the payment was an earlier one returned for a repeated idempotency key.
 */
@Value
public class PaymentReceipt {
    Payment payment;
    Invoice invoice;
    boolean replayed;
}
