package com.flagship.invoice_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import com.flagship.invoice_ledger.subscription.UsageLimits;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UsageLimitsResponse {

    @JsonProperty("plan")
    SubscriptionPlan plan;

    @JsonProperty("can_create_invoice")
    boolean canCreateInvoice;

    @JsonProperty("can_create_client")
    boolean canCreateClient;

    @JsonProperty("invoices_remaining")
    int invoicesRemaining;

    @JsonProperty("clients_remaining")
    int clientsRemaining;

    public static UsageLimitsResponse from(UsageLimits limits) {
        return UsageLimitsResponse.builder()
            .plan(limits.getPlan())
            .canCreateInvoice(limits.isCanCreateInvoice())
            .canCreateClient(limits.isCanCreateClient())
            .invoicesRemaining(limits.getInvoicesRemaining())
            .clientsRemaining(limits.getClientsRemaining())
            .build();
    }
}
