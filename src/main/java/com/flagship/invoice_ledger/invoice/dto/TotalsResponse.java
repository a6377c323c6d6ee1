package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.invoice.InvoiceTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class TotalsResponse {

    @JsonProperty("line_amounts")
    List<BigDecimal> lineAmounts;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total")
    BigDecimal total;

    public static TotalsResponse from(InvoiceTotals totals) {
        return TotalsResponse.builder()
            .lineAmounts(totals.getLineAmounts())
            .subtotal(totals.getSubtotal())
            .discountAmount(totals.getDiscountAmount())
            .taxRate(totals.getTaxRatePercent())
            .taxAmount(totals.getTaxAmount())
            .total(totals.getTotal())
            .build();
    }
}
