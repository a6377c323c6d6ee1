package com.flagship.invoice_ledger.payment;

import com.flagship.invoice_ledger.exception.InvalidRequestException;

import java.util.Locale;

/**
 * ISO-4217 currencies an invoice can be billed in.
 * A payment always takes the currency of its invoice.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    CAD,
    AUD,
    INR,
    JPY;

    public static final CurrencyCode DEFAULT = USD;

    /**
     * Parses a request value; null or blank means {@link #DEFAULT}.
     *
     * @throws InvalidRequestException for an unsupported code
     */
    public static CurrencyCode parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported currency code: " + value);
        }
    }
}
