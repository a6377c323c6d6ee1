package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class TotalsPreviewRequest {

    @Valid
    @JsonProperty("items")
    List<LineItemRequest> items;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;
}
