package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.invoice.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class InvoiceCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    UUID ownerId;
    UUID clientId;
    String invoiceNumber;
    String currency;
    BigDecimal total;
    LocalDate dueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceCreated";

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

    public static InvoiceCreatedEvent of(Invoice invoice) {
        return new InvoiceCreatedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getOwnerId(),
            invoice.getClientId(),
            invoice.getInvoiceNumber(),
            invoice.getCurrency().name(),
            invoice.getTotal(),
            invoice.getDueDate(),
            Instant.now()
        );
    }
}
