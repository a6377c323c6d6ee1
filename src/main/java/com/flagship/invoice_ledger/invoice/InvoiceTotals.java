package com.flagship.invoice_ledger.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of pricing an invoice. All amounts are rounded to two decimals.
 * {@code lineAmounts} is parallel to the input line items.
 */
@Value
public class InvoiceTotals {
    List<BigDecimal> lineAmounts;
    BigDecimal subtotal;
    BigDecimal discountAmount;
    BigDecimal taxRatePercent;
    BigDecimal taxAmount;
    BigDecimal total;
}
