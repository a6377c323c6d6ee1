package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class StatusChangeRequest {

    @NotNull(message = "Target status is required")
    @JsonProperty("status")
    InvoiceStatus status;
}
