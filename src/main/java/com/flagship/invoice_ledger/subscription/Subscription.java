package com.flagship.invoice_ledger.subscription;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class Subscription {
    UUID id;
    UUID ownerId;
    SubscriptionPlan plan;
    SubscriptionStatus status;
    BigDecimal monthlyPrice;
    int invoiceLimit;
    int clientLimit;
    int invoicesSent;
    int clientsCreated;
    Instant currentPeriodStart;
    Instant currentPeriodEnd;
    Instant createdAt;
    Instant updatedAt;
}
