package com.flagship.invoice_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.subscription.SubscriptionPlan;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ChangePlanRequest {

    @NotNull(message = "Plan is required")
    @JsonProperty("plan")
    SubscriptionPlan plan;
}
