package com.flagship.invoice_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in, or already relayed from, the outbox table.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Invoice", "Subscription", "Client"
    UUID aggregateId;          // Kafka key
    String eventType;          // e.g. "PaymentApplied"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
