package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A completed payment was credited to an invoice. Keyed by invoice id so that it
 * is ordered with the invoice's status events.
 */
@Value
public class PaymentAppliedEvent implements LedgerEvent {
    UUID eventId;
    UUID paymentId;
    UUID invoiceId;
    UUID ownerId;
    BigDecimal amount;
    String currency;
    String method;
    LocalDate paymentDate;
    BigDecimal invoiceAmountPaid;
    BigDecimal invoiceAmountDue;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Invoice";
    }

    @Override
    public UUID getAggregateId() {
        return invoiceId;
    }

    public static PaymentAppliedEvent of(Payment payment, Invoice invoice) {
        return new PaymentAppliedEvent(
            UUID.randomUUID(),
            payment.getId(),
            invoice.getId(),
            invoice.getOwnerId(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getMethod().name(),
            payment.getPaymentDate(),
            invoice.getAmountPaid(),
            invoice.getAmountDue(),
            Instant.now()
        );
    }
}
