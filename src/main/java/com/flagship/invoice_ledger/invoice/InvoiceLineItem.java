package com.flagship.invoice_ledger.invoice;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class InvoiceLineItem {
    int position;
    String description;
    BigDecimal quantity;
    BigDecimal rate;
    BigDecimal amount;

    public LineItem toLineItem() {
        return new LineItem(description, quantity, rate);
    }
}
