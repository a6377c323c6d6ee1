package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CreateInvoiceRequest {

    @NotNull(message = "Client ID is required")
    @JsonProperty("client_id")
    UUID clientId;

    @NotNull(message = "Issue date is required")
    @JsonProperty("issue_date")
    LocalDate issueDate;

    @NotNull(message = "Due date is required")
    @JsonProperty("due_date")
    LocalDate dueDate;

    @Size(max = 3)
    @JsonProperty("currency")
    String currency;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @Size(max = 2000)
    @JsonProperty("notes")
    String notes;

    @Size(max = 2000)
    @JsonProperty("terms")
    String terms;

    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;
}
