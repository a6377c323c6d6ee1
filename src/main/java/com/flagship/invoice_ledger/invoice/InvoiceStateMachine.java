package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.exception.InvalidStatusTransitionException;
import com.flagship.invoice_ledger.exception.InvoiceImmutableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * The only place an invoice's stored status changes.
 *
 * Allowed transitions:
 * - DRAFT  -> SENT, PAID
 * - SENT   -> VIEWED, PAID
 * - VIEWED -> VIEWED (no-op, first view timestamp kept), PAID
 * - PAID   -> nothing; any attempt is InvoiceImmutable
 *
 * A transition to PAID is only legal once amountPaid equals total. Settling an
 * outstanding balance is the payment engine's job, which then calls back here.
 */
@Component
@Slf4j
public class InvoiceStateMachine {

    public boolean canTransition(InvoiceStatus from, InvoiceStatus to) {
        return switch (from) {
            case DRAFT -> to == InvoiceStatus.SENT || to == InvoiceStatus.PAID;
            case SENT -> to == InvoiceStatus.VIEWED || to == InvoiceStatus.PAID;
            case VIEWED -> to == InvoiceStatus.VIEWED || to == InvoiceStatus.PAID;
            case PAID -> false;
        };
    }

    /**
     * Applies a transition to a locked invoice.
     *
     * @return true if the stored status changed, false for the VIEWED no-op
     * @throws InvoiceImmutableException if the invoice is already PAID
     * @throws InvalidStatusTransitionException if the edge is not allowed
     */
    public boolean transition(InvoiceEntity invoice, InvoiceStatus target, Instant now) {
        InvoiceStatus from = invoice.getStatus();
        if (from.isTerminal()) {
            throw new InvoiceImmutableException(invoice.getId(), "moved to " + target);
        }
        if (!canTransition(from, target)) {
            throw new InvalidStatusTransitionException("Invoice", from, target);
        }
        if (from == target) {
            return false;
        }

        switch (target) {
            case SENT -> invoice.markSent(now);
            case VIEWED -> invoice.markViewed(now);
            case PAID -> {
                if (invoice.getAmountPaid().compareTo(invoice.getTotal()) != 0) {
                    throw new IllegalStateException("Invoice " + invoice.getId()
                        + " has an outstanding balance of " + invoice.getAmountDue().toPlainString());
                }
                invoice.markPaid(now);
            }
            default -> throw new InvalidStatusTransitionException("Invoice", from, target);
        }

        log.debug("Invoice status changed: invoiceId={}, from={}, to={}", invoice.getId(), from, target);
        return true;
    }
}
