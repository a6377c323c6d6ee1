package com.flagship.invoice_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.subscription.QuotaResource;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ReserveQuotaRequest {

    @NotNull(message = "Resource is required")
    @JsonProperty("resource")
    QuotaResource resource;
}
