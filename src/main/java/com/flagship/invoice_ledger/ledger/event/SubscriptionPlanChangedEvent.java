package com.flagship.invoice_ledger.ledger.event;

import com.flagship.invoice_ledger.subscription.Subscription;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SubscriptionPlanChangedEvent implements LedgerEvent {
    UUID eventId;
    UUID subscriptionId;
    UUID ownerId;
    SubscriptionPlan fromPlan;
    SubscriptionPlan toPlan;
    int invoiceLimit;
    int clientLimit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SubscriptionPlanChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Subscription";
    }

    @Override
    public UUID getAggregateId() {
        return subscriptionId;
    }

    public static SubscriptionPlanChangedEvent of(SubscriptionPlan from, Subscription subscription) {
        return new SubscriptionPlanChangedEvent(
            UUID.randomUUID(),
            subscription.getId(),
            subscription.getOwnerId(),
            from,
            subscription.getPlan(),
            subscription.getInvoiceLimit(),
            subscription.getClientLimit(),
            Instant.now()
        );
    }
}
