package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.client.Client;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ClientCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID clientId;
    UUID ownerId;
    String name;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClientCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Client";
    }

    @Override
    public UUID getAggregateId() {
        return clientId;
    }

    public static ClientCreatedEvent of(Client client) {
        return new ClientCreatedEvent(UUID.randomUUID(), client.getId(), client.getOwnerId(), client.getName(), Instant.now());
    }
}
