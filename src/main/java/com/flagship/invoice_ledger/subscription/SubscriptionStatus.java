package com.flagship.invoice_ledger.subscription;

public enum SubscriptionStatus {
    ACTIVE,
    INACTIVE,
    CANCELLED,
    PAST_DUE,
    TRIALING
}
