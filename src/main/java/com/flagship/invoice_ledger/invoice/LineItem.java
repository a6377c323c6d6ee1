package com.flagship.invoice_ledger.invoice;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Unpriced line item as supplied by a caller: what was sold, how many, at what rate.
 */
@Value
public class LineItem {
    String description;
    BigDecimal quantity;
    BigDecimal rate;
}
