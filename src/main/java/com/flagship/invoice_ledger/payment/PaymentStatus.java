package com.flagship.invoice_ledger.payment;

/**
 * Lifecycle of a payment recorded against an invoice.
 *
 * Only COMPLETED payments count towards an invoice's amountPaid.
 */
public enum PaymentStatus {
    /**
     * Recorded but not yet confirmed. Does not affect invoice totals.
     * Can transition to COMPLETED or FAILED.
     */
    PENDING,

    /**
     * Confirmed and credited to the invoice.
     * Terminal state: the payment can no longer be edited or deleted.
     */
    COMPLETED,

    /**
     * Did not go through. Terminal state, never credited.
     */
    FAILED;

    public boolean canTransitionTo(PaymentStatus target) {
        return this == PENDING && (target == COMPLETED || target == FAILED);
    }
}
