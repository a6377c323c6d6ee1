package com.flagship.invoice_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only snapshot of a payment.
 */
@Value
public class Payment {
    UUID id;
    UUID invoiceId;
    UUID ownerId;
    BigDecimal amount;
    CurrencyCode currency;
    PaymentMethod method;
    PaymentStatus status;
    LocalDate paymentDate;
    String referenceNumber;
    String notes;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    public boolean isCompleted() {
        return status == PaymentStatus.COMPLETED;
    }
}
