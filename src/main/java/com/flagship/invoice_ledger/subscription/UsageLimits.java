package com.flagship.invoice_ledger.subscription;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory view of remaining quota. The authoritative check is the reservation itself.
 */
@Value
@Builder
public class UsageLimits {
    SubscriptionPlan plan;
    boolean canCreateInvoice;
    boolean canCreateClient;
    int invoicesRemaining;
    int clientsRemaining;

    static UsageLimits of(Subscription subscription) {
        int invoicesRemaining = Math.max(0, subscription.getInvoiceLimit() - subscription.getInvoicesSent());
        int clientsRemaining = Math.max(0, subscription.getClientLimit() - subscription.getClientsCreated());
        return UsageLimits.builder()
            .plan(subscription.getPlan())
            .canCreateInvoice(invoicesRemaining > 0)
            .canCreateClient(clientsRemaining > 0)
            .invoicesRemaining(invoicesRemaining)
            .clientsRemaining(clientsRemaining)
            .build();
    }
}
