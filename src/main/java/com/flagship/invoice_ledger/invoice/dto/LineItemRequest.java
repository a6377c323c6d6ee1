package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.invoice.LineItem;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line item in a create, update or preview request.
 * Quantity and rate are validated by the totals calculator.
 */
@Value
public class LineItemRequest {

    @Size(max = 500)
    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("rate")
    BigDecimal rate;

    public LineItem toLineItem() {
        return new LineItem(description, quantity, rate);
    }
}
