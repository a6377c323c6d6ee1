package com.flagship.invoice_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and ledger identifiers carried in the logging MDC.
 *
 * The correlation id is set once per HTTP request by {@link CorrelationIdFilter};
 * owner and invoice ids are added by ledger operations for their duration
 * through {@link #scope(UUID, UUID)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String OWNER_ID_MDC_KEY = "ownerId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";

    private CorrelationContext() {
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts owner and invoice ids in the MDC until the returned scope is closed.
     * Null ids are skipped. Values present before the scope are restored on close.
     */
    public static Scope scope(UUID ownerId, UUID invoiceId) {
        String previousOwner = MDC.get(OWNER_ID_MDC_KEY);
        String previousInvoice = MDC.get(INVOICE_ID_MDC_KEY);
        if (ownerId != null) {
            MDC.put(OWNER_ID_MDC_KEY, ownerId.toString());
        }
        if (invoiceId != null) {
            MDC.put(INVOICE_ID_MDC_KEY, invoiceId.toString());
        }
        return () -> {
            restore(OWNER_ID_MDC_KEY, previousOwner);
            restore(INVOICE_ID_MDC_KEY, previousInvoice);
        };
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
