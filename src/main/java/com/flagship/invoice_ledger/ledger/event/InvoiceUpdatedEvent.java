package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.invoice.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Invoice content changed. Carries the amounts after the change.
 */
@Value
public class InvoiceUpdatedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    UUID ownerId;
    BigDecimal total;
    BigDecimal amountPaid;
    BigDecimal amountDue;
    long version;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceUpdated";

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

    public static InvoiceUpdatedEvent of(Invoice invoice) {
        return new InvoiceUpdatedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getOwnerId(),
            invoice.getTotal(),
            invoice.getAmountPaid(),
            invoice.getAmountDue(),
            invoice.getVersion(),
            Instant.now()
        );
    }
}
