package com.flagship.invoice_ledger.payment;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentStats {
    long totalPayments;
    Map<PaymentStatus, Long> countByStatus;
    BigDecimal totalCompletedAmount;
    BigDecimal averageCompletedAmount;
    BigDecimal totalPendingAmount;
}
