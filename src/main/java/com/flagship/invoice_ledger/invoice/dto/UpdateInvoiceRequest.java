package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Partial update of an invoice. Null fields are left unchanged.
 *
 * Derived fields (totals, amount_paid, amount_due, status) are not part of
 * this request; unknown properties are rejected by the JSON mapper.
 */
@Value
@Builder
@Jacksonized
public class UpdateInvoiceRequest {

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("issue_date")
    LocalDate issueDate;

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

    public boolean changesPricing() {
        return items != null || taxRate != null || discountAmount != null;
    }
}
