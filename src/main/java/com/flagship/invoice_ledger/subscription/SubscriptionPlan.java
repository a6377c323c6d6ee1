package com.flagship.invoice_ledger.subscription;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Plan catalog. Limits are copied onto the subscription row when the plan is
 * assigned, so the quota check is a single-row comparison.
 */
@Getter
@RequiredArgsConstructor
public enum SubscriptionPlan {
    FREE(5, 5, new BigDecimal("0.00")),
    BASIC(50, 25, new BigDecimal("9.99")),
    PRO(200, 100, new BigDecimal("29.99")),
    ENTERPRISE(999_999, 999_999, new BigDecimal("99.99"));

    private final int invoiceLimit;
    private final int clientLimit;
    private final BigDecimal monthlyPrice;
}
