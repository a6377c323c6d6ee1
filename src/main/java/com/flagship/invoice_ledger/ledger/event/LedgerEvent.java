package com.flagship.invoice_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed fact about the ledger, relayed to Kafka through the outbox.
 *
 * Consumers (dashboards, search, forecasting) only read these; nothing flows back.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    String getEventType();

    String getAggregateType();

    /**
     * Kafka key. Events sharing an aggregate id keep their relative order.
     */
    UUID getAggregateId();

    Instant getOccurredAt();
}
