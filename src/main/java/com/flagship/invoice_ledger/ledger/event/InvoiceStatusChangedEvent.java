package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Stored status changed. A transition to PAID carries paidAt and the final amountPaid.
 */
@Value
public class InvoiceStatusChangedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    UUID ownerId;
    InvoiceStatus fromStatus;
    InvoiceStatus toStatus;
    BigDecimal amountPaid;
    Instant paidAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceStatusChanged";

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

    public static InvoiceStatusChangedEvent of(InvoiceStatus from, Invoice invoice) {
        return new InvoiceStatusChangedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getOwnerId(),
            from,
            invoice.getStatus(),
            invoice.getAmountPaid(),
            invoice.getPaidAt(),
            Instant.now()
        );
    }
}
