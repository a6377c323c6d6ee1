package com.flagship.invoice_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.subscription.Subscription;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import com.flagship.invoice_ledger.subscription.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SubscriptionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("plan")
    SubscriptionPlan plan;

    @JsonProperty("status")
    SubscriptionStatus status;

    @JsonProperty("monthly_price")
    BigDecimal monthlyPrice;

    @JsonProperty("invoice_limit")
    int invoiceLimit;

    @JsonProperty("client_limit")
    int clientLimit;

    @JsonProperty("invoices_sent")
    int invoicesSent;

    @JsonProperty("clients_created")
    int clientsCreated;

    @JsonProperty("current_period_start")
    Instant currentPeriodStart;

    @JsonProperty("current_period_end")
    Instant currentPeriodEnd;

    public static SubscriptionResponse from(Subscription subscription) {
        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .plan(subscription.getPlan())
            .status(subscription.getStatus())
            .monthlyPrice(subscription.getMonthlyPrice())
            .invoiceLimit(subscription.getInvoiceLimit())
            .clientLimit(subscription.getClientLimit())
            .invoicesSent(subscription.getInvoicesSent())
            .clientsCreated(subscription.getClientsCreated())
            .currentPeriodStart(subscription.getCurrentPeriodStart())
            .currentPeriodEnd(subscription.getCurrentPeriodEnd())
            .build();
    }
}
