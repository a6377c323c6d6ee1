package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.client.ClientDirectory;
import com.flagship.invoice_ledger.exception.ContentionException;
import com.flagship.invoice_ledger.exception.InvalidRequestException;
import com.flagship.invoice_ledger.exception.InvoiceImmutableException;
import com.flagship.invoice_ledger.exception.NotFoundException;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceEditor;
import com.flagship.invoice_ledger.invoice.InvoiceEntity;
import com.flagship.invoice_ledger.invoice.InvoiceRepository;
import com.flagship.invoice_ledger.invoice.InvoiceStateMachine;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import com.flagship.invoice_ledger.invoice.InvoiceTotals;
import com.flagship.invoice_ledger.invoice.LineItem;
import com.flagship.invoice_ledger.invoice.TotalsCalculator;
import com.flagship.invoice_ledger.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoice_ledger.invoice.dto.UpdateInvoiceRequest;
import com.flagship.invoice_ledger.ledger.event.InvoiceCreatedEvent;
import com.flagship.invoice_ledger.ledger.event.InvoiceDeletedEvent;
import com.flagship.invoice_ledger.ledger.event.InvoiceStatusChangedEvent;
import com.flagship.invoice_ledger.ledger.event.InvoiceUpdatedEvent;
import com.flagship.invoice_ledger.ledger.event.PaymentAppliedEvent;
import com.flagship.invoice_ledger.ledger.event.PaymentFailedEvent;
import com.flagship.invoice_ledger.observability.CorrelationContext;
import com.flagship.invoice_ledger.observability.LedgerMetrics;
import com.flagship.invoice_ledger.outbox.OutboxService;
import com.flagship.invoice_ledger.payment.IdempotencyService;
import com.flagship.invoice_ledger.payment.Payment;
import com.flagship.invoice_ledger.payment.PaymentApplicationEngine;
import com.flagship.invoice_ledger.payment.PaymentEntity;
import com.flagship.invoice_ledger.payment.PaymentRepository;
import com.flagship.invoice_ledger.payment.PaymentStatus;
import com.flagship.invoice_ledger.payment.dto.RecordPaymentRequest;
import com.flagship.invoice_ledger.payment.dto.UpdatePaymentRequest;
import com.flagship.invoice_ledger.subscription.QuotaEnforcer;
import com.flagship.invoice_ledger.subscription.QuotaResource;
import com.flagship.invoice_ledger.subscription.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for every ledger mutation.
 *
 * Each public method is one transaction (see {@link LedgerTransactions}) that:
 * 1. Takes the row lock of the invoice it touches (or the subscription row,
 *    through the quota enforcer)
 * 2. Delegates to the totals calculator, state machine or payment engine
 * 3. Records the resulting events in the outbox
 *
 * Either all of it commits or none of it does. Lock waits are bounded; giving up
 * raises a retryable ContentionException. Reads live in the query services.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String UNIQUE_VIOLATION = "23505";

    private final TotalsCalculator totalsCalculator;
    private final InvoiceEditor invoiceEditor;
    private final InvoiceStateMachine stateMachine;
    private final PaymentApplicationEngine paymentEngine;
    private final QuotaEnforcer quotaEnforcer;
    private final IdempotencyService idempotencyService;
    private final ClientDirectory clientDirectory;
    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final OutboxService outboxService;
    private final LedgerTransactions transactions;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Prices line items without persisting anything.
     */
    public InvoiceTotals previewTotals(List<LineItem> items, BigDecimal discountAmount, BigDecimal taxRatePercent) {
        return totalsCalculator.calculate(items, discountAmount, taxRatePercent);
    }

    /**
     * Consumes one unit of the given quota on its own. Invoice and client creation
     * reserve their unit inside their own transaction instead.
     */
    public Reservation reserveQuota(UUID ownerId, QuotaResource resource) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, null)) {
            return transactions.write("reserveQuota", () -> quotaEnforcer.reserve(ownerId, resource));
        }
    }

    /**
     * Reserves INVOICE quota, numbers, prices and stores a DRAFT invoice.
     * A failure at any step releases the quota unit with the rollback.
     */
    public Invoice createInvoice(UUID ownerId, CreateInvoiceRequest request) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, null)) {
            return transactions.write("createInvoice", () -> {
                requireClient(request.getClientId(), ownerId);
                Reservation reservation = quotaEnforcer.reserve(ownerId, QuotaResource.INVOICE);

                InvoiceEntity entity = invoiceEditor.createDraft(ownerId, request);
                invoiceRepository.flush();
                Invoice invoice = entity.toDomain();

                outboxService.record(InvoiceCreatedEvent.of(invoice));
                metrics.recordInvoiceCreated(invoice.getCurrency().name());
                log.info("Invoice created: invoiceId={}, number={}, total={}, invoicesRemaining={}",
                    invoice.getId(), invoice.getInvoiceNumber(), invoice.getTotal(), reservation.getRemaining());
                return invoice;
            });
        }
    }

    /**
     * Edits a non-paid invoice and reprices it. If the new total equals what was
     * already paid, the invoice becomes PAID.
     */
    public Invoice updateInvoice(UUID invoiceId, UUID ownerId, UpdateInvoiceRequest changes) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("updateInvoice", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);
                if (invoice.isPaid()) {
                    throw new InvoiceImmutableException(invoiceId, "updated");
                }
                if (changes.getClientId() != null && !changes.getClientId().equals(invoice.getClientId())) {
                    requireClient(changes.getClientId(), ownerId);
                }

                InvoiceStatus before = invoice.getStatus();
                boolean paymentsOnRecord = changes.getCurrency() != null
                    && paymentRepository.existsByInvoiceIdAndStatusNot(invoiceId, PaymentStatus.FAILED);
                invoiceEditor.applyChanges(invoice, changes, paymentsOnRecord);
                if (invoice.getAmountPaid().signum() > 0 && Money.isZero(invoice.getAmountDue())) {
                    stateMachine.transition(invoice, InvoiceStatus.PAID, now());
                }
                invoiceRepository.flush();

                Invoice updated = invoice.toDomain();
                outboxService.record(InvoiceUpdatedEvent.of(updated));
                recordStatusChange(before, updated);
                log.info("Invoice updated: total={}, amountDue={}, status={}",
                    updated.getTotal(), updated.getAmountDue(), updated.getStatus());
                return updated;
            });
        }
    }

    /**
     * Deletes a non-paid invoice with its line items and payments. Quota is not refunded.
     */
    public void deleteInvoice(UUID invoiceId, UUID ownerId) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            transactions.run("deleteInvoice", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);
                if (invoice.isPaid()) {
                    throw new InvoiceImmutableException(invoiceId, "deleted");
                }
                String number = invoice.getInvoiceNumber();
                invoiceRepository.delete(invoice);
                invoiceRepository.flush();

                outboxService.record(InvoiceDeletedEvent.of(invoiceId, ownerId, number));
                log.info("Invoice deleted: number={}", number);
            });
        }
    }

    /**
     * Owner-initiated status change. Moving to PAID settles any outstanding
     * balance with a recorded payment.
     */
    public Invoice transitionStatus(UUID invoiceId, UUID ownerId, InvoiceStatus target) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("transitionStatus", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);
                if (invoice.isPaid()) {
                    throw new InvoiceImmutableException(invoiceId, "moved to " + target);
                }
                InvoiceStatus before = invoice.getStatus();

                Optional<PaymentEntity> settlement = Optional.empty();
                if (target == InvoiceStatus.PAID) {
                    settlement = paymentEngine.settleOutstanding(invoice, now());
                } else {
                    stateMachine.transition(invoice, target, now());
                }
                invoiceRepository.flush();

                Invoice updated = invoice.toDomain();
                settlement.ifPresent(payment -> {
                    outboxService.record(PaymentAppliedEvent.of(payment.toDomain(), updated));
                    metrics.recordPaymentApplied(payment.getMethod().name());
                    log.info("Outstanding balance settled: paymentId={}, amount={}", payment.getId(), payment.getAmount());
                });
                recordStatusChange(before, updated);
                return updated;
            });
        }
    }

    public Invoice sendInvoice(UUID invoiceId, UUID ownerId) {
        return transitionStatus(invoiceId, ownerId, InvoiceStatus.SENT);
    }

    public Invoice markPaid(UUID invoiceId, UUID ownerId) {
        return transitionStatus(invoiceId, ownerId, InvoiceStatus.PAID);
    }

    /**
     * Client-side view. Moves SENT to VIEWED; repeated views keep the first
     * timestamp. Drafts are not visible to clients.
     */
    public Invoice markViewed(UUID invoiceId) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(null, invoiceId)) {
            return transactions.write("markViewed", () -> {
                InvoiceEntity invoice = invoiceRepository.findByIdForUpdate(invoiceId)
                    .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
                InvoiceStatus before = invoice.getStatus();
                if (before == InvoiceStatus.DRAFT) {
                    throw new NotFoundException("Invoice", invoiceId);
                }
                if (before == InvoiceStatus.SENT) {
                    stateMachine.transition(invoice, InvoiceStatus.VIEWED, now());
                    invoiceRepository.flush();
                }
                Invoice viewed = invoice.toDomain();
                recordStatusChange(before, viewed);
                return viewed;
            });
        }
    }

    /**
     * Applies a completed payment. With an idempotency key, a repeated request
     * returns the original payment instead of paying twice.
     */
    public PaymentReceipt applyPayment(UUID invoiceId, UUID ownerId, RecordPaymentRequest request, String idempotencyKey) {
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim();
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            PaymentReceipt receipt = transactions.write("applyPayment", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);

                if (key != null) {
                    Optional<PaymentEntity> previous = idempotencyService.findPrevious(ownerId, key);
                    if (previous.isPresent()) {
                        return replay(previous.get(), invoice);
                    }
                    metrics.recordIdempotencyMiss();
                }

                InvoiceStatus before = invoice.getStatus();
                PaymentEntity payment = paymentEngine.apply(
                    invoice, request.getAmount(), request.toDetails(today()), key, now());
                invoiceRepository.flush();

                Payment applied = payment.toDomain();
                Invoice updated = invoice.toDomain();
                outboxService.record(PaymentAppliedEvent.of(applied, updated));
                recordStatusChange(before, updated);
                metrics.recordPaymentApplied(applied.getMethod().name());
                log.info("Payment applied: paymentId={}, amount={}, amountPaid={}, amountDue={}",
                    applied.getId(), applied.getAmount(), updated.getAmountPaid(), updated.getAmountDue());
                return new PaymentReceipt(applied, updated, false);
            });

            if (key != null && !receipt.isReplayed()) {
                idempotencyService.remember(ownerId, key, receipt.getPayment().getId());
            }
            return receipt;
        } catch (DataIntegrityViolationException e) {
            if (key == null || !isDuplicateKey(e)) {
                throw e;
            }
            // Same key raced on another invoice; a retry will find the winner.
            metrics.recordContention("applyPayment");
            throw new ContentionException("applyPayment", e);
        }
    }

    /**
     * Records a payment awaiting confirmation; invoice totals are untouched.
     */
    public Payment recordPendingPayment(UUID invoiceId, UUID ownerId, RecordPaymentRequest request) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("recordPendingPayment", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);
                PaymentEntity payment = paymentEngine.recordPending(invoice, request.getAmount(), request.toDetails(today()));
                paymentRepository.flush();
                log.info("Pending payment recorded: paymentId={}, amount={}", payment.getId(), payment.getAmount());
                return payment.toDomain();
            });
        }
    }

    /**
     * Completes a pending payment, validated against the invoice balance now.
     */
    public PaymentReceipt completePayment(UUID paymentId, UUID ownerId) {
        UUID invoiceId = invoiceIdOf(paymentId, ownerId);
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("completePayment", () -> {
                InvoiceEntity invoice = lockOwnedInvoice(invoiceId, ownerId);
                PaymentEntity payment = loadPayment(paymentId, ownerId);
                InvoiceStatus before = invoice.getStatus();

                paymentEngine.complete(invoice, payment, now());
                invoiceRepository.flush();

                Payment completed = payment.toDomain();
                Invoice updated = invoice.toDomain();
                outboxService.record(PaymentAppliedEvent.of(completed, updated));
                recordStatusChange(before, updated);
                metrics.recordPaymentApplied(completed.getMethod().name());
                log.info("Payment completed: paymentId={}, amountDue={}", paymentId, updated.getAmountDue());
                return new PaymentReceipt(completed, updated, false);
            });
        }
    }

    public Payment failPayment(UUID paymentId, UUID ownerId, String reason) {
        UUID invoiceId = invoiceIdOf(paymentId, ownerId);
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("failPayment", () -> {
                lockOwnedInvoice(invoiceId, ownerId);
                PaymentEntity payment = paymentEngine.fail(loadPayment(paymentId, ownerId), reason);
                paymentRepository.flush();

                Payment failed = payment.toDomain();
                outboxService.record(PaymentFailedEvent.of(failed));
                return failed;
            });
        }
    }

    public Payment updatePayment(UUID paymentId, UUID ownerId, UpdatePaymentRequest changes) {
        UUID invoiceId = invoiceIdOf(paymentId, ownerId);
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            return transactions.write("updatePayment", () -> {
                lockOwnedInvoice(invoiceId, ownerId);
                PaymentEntity payment = paymentEngine.revise(loadPayment(paymentId, ownerId), changes.toDetails());
                paymentRepository.flush();
                log.info("Payment updated: paymentId={}", paymentId);
                return payment.toDomain();
            });
        }
    }

    public void deletePayment(UUID paymentId, UUID ownerId) {
        UUID invoiceId = invoiceIdOf(paymentId, ownerId);
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, invoiceId)) {
            transactions.run("deletePayment", () -> {
                lockOwnedInvoice(invoiceId, ownerId);
                paymentEngine.discard(loadPayment(paymentId, ownerId));
                paymentRepository.flush();
            });
        }
    }

    private PaymentReceipt replay(PaymentEntity previous, InvoiceEntity invoice) {
        if (!previous.getInvoiceId().equals(invoice.getId())) {
            throw new InvalidRequestException("Idempotency key was already used for a different invoice");
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning existing payment: paymentId={}", previous.getId());
        return new PaymentReceipt(previous.toDomain(), invoice.toDomain(), true);
    }

    private void recordStatusChange(InvoiceStatus before, Invoice after) {
        if (before == after.getStatus()) {
            return;
        }
        outboxService.record(InvoiceStatusChangedEvent.of(before, after));
        metrics.recordTransition(before, after.getStatus());
        log.info("Invoice status changed: from={}, to={}", before, after.getStatus());
    }

    /**
     * Unique violations only. Check and trigger violations are bugs, not races,
     * and must not be reported as retryable.
     */
    static boolean isDuplicateKey(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        Throwable cause = e.getMostSpecificCause();
        return cause instanceof SQLException && UNIQUE_VIOLATION.equals(((SQLException) cause).getSQLState());
    }

    private InvoiceEntity lockOwnedInvoice(UUID invoiceId, UUID ownerId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
            .filter(invoice -> invoice.getOwnerId().equals(ownerId))
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
    }

    private PaymentEntity loadPayment(UUID paymentId, UUID ownerId) {
        return paymentRepository.findByIdAndOwnerId(paymentId, ownerId)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    private UUID invoiceIdOf(UUID paymentId, UUID ownerId) {
        return paymentRepository.findInvoiceIdByIdAndOwnerId(paymentId, ownerId)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    private void requireClient(UUID clientId, UUID ownerId) {
        if (!clientDirectory.clientBelongsTo(clientId, ownerId)) {
            throw new NotFoundException("Client", clientId);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
