package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.subscription.QuotaResource;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Business metrics for ledger operations.
 *
 * Metrics:
 * - ledger.invoices.created: invoices created, by currency
 * - ledger.invoices.transitions: stored status changes, by from/to
 * - ledger.payments.applied: completed payments, by method
 * - ledger.quota.reservations: reservation outcomes, by resource
 * - ledger.quota.rejected: reservations refused for an exhausted quota
 * - ledger.contention: operations that gave up waiting for a lock
 * - ledger.idempotency.cache: repeated payment requests, hit or miss
 * - ledger.operation.latency: duration of each ledger operation, by outcome
 */
@Component
@RequiredArgsConstructor
public class LedgerMetrics {

    private final MeterRegistry registry;

    public void recordInvoiceCreated(String currency) {
        registry.counter("ledger.invoices.created", "currency", sanitizeTag(currency)).increment();
    }

    public void recordTransition(Enum<?> from, Enum<?> to) {
        registry.counter("ledger.invoices.transitions", "from", from.name(), "to", to.name()).increment();
    }

    public void recordPaymentApplied(String method) {
        registry.counter("ledger.payments.applied", "method", sanitizeTag(method)).increment();
    }

    public void recordQuotaReservation(QuotaResource resource, String outcome) {
        registry.counter("ledger.quota.reservations",
                "resource", resource.name(),
                "outcome", outcome
        ).increment();
        if ("rejected".equals(outcome)) {
            registry.counter("ledger.quota.rejected", "resource", resource.name()).increment();
        }
    }

    public void recordContention(String operation) {
        registry.counter("ledger.contention", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, String outcome, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
