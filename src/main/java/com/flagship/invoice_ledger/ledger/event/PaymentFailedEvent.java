package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentFailedEvent implements LedgerEvent {
    UUID eventId;
    UUID paymentId;
    UUID invoiceId;
    UUID ownerId;
    BigDecimal amount;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

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

    public static PaymentFailedEvent of(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getInvoiceId(),
            payment.getOwnerId(),
            payment.getAmount(),
            payment.getFailureReason(),
            Instant.now()
        );
    }
}
