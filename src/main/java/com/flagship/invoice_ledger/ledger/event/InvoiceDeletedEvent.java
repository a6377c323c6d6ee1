package com.flagship.invoice_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceDeletedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    UUID ownerId;
    String invoiceNumber;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceDeleted";

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

    public static InvoiceDeletedEvent of(UUID invoiceId, UUID ownerId, String invoiceNumber) {
        return new InvoiceDeletedEvent(UUID.randomUUID(), invoiceId, ownerId, invoiceNumber, Instant.now());
    }
}
