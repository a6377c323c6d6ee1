package com.flagship.invoice_ledger.invoice;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-owner invoice summary. Overdue invoices are also counted under their stored status.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InvoiceStats {
    long totalInvoices;
    Map<InvoiceStatus, Long> countByStatus;
    long overdueCount;
    BigDecimal totalInvoiced;
    BigDecimal totalPaid;
    BigDecimal totalOutstanding;
}
