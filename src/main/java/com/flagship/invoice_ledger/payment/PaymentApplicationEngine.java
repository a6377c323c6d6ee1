package com.flagship.invoice_ledger.payment;

import com.flagship.invoice_ledger.exception.InvalidRequestException;
import com.flagship.invoice_ledger.exception.InvoiceAlreadyPaidException;
import com.flagship.invoice_ledger.exception.PaymentExceedsAmountDueException;
import com.flagship.invoice_ledger.invoice.InvoiceEntity;
import com.flagship.invoice_ledger.invoice.InvoiceStateMachine;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import com.flagship.invoice_ledger.ledger.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * All writes to payments, and the only code that credits an invoice's amountPaid.
 *
 * Every method expects the invoice to be row-locked by the caller's transaction,
 * so the read of amountDue and the credit that follows cannot interleave with
 * another payment on the same invoice. For each completed payment:
 *
 *   amountPaid' = amountPaid + amount
 *   amountDue'  = total - amountPaid'
 *   amountDue' == 0  =>  invoice moves to PAID
 *
 * Pending payments are validated the same way when they complete, against the
 * balance at that moment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentApplicationEngine {

    private static final String SETTLEMENT_NOTE = "Outstanding balance settled when the invoice was marked paid";

    private final PaymentRepository paymentRepository;
    private final InvoiceStateMachine stateMachine;
    private final Clock clock;

    /**
     * Records a completed payment and credits it to the invoice.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity apply(InvoiceEntity invoice, BigDecimal amount, PaymentDetails details,
                               String idempotencyKey, Instant now) {
        BigDecimal rounded = checkApplicable(invoice, amount);
        PaymentEntity payment = paymentRepository.save(PaymentEntity.completed(
            invoice.getId(), invoice.getOwnerId(), rounded, invoice.getCurrency(), details, idempotencyKey));
        credit(invoice, rounded, now);
        return payment;
    }

    /**
     * Records a payment that does not affect totals until {@link #complete} is called.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity recordPending(InvoiceEntity invoice, BigDecimal amount, PaymentDetails details) {
        BigDecimal rounded = checkApplicable(invoice, amount);
        return paymentRepository.save(PaymentEntity.pending(
            invoice.getId(), invoice.getOwnerId(), rounded, invoice.getCurrency(), details));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity complete(InvoiceEntity invoice, PaymentEntity payment, Instant now) {
        payment.ensureMutable();
        if (payment.getCurrency() != invoice.getCurrency()) {
            throw new InvalidRequestException(String.format(
                "Payment currency %s does not match invoice currency %s", payment.getCurrency(), invoice.getCurrency()));
        }
        checkApplicable(invoice, payment.getAmount());
        payment.complete();
        credit(invoice, payment.getAmount(), now);
        return payment;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity fail(PaymentEntity payment, String reason) {
        payment.fail(reason);
        log.info("Payment failed: paymentId={}, reason={}", payment.getId(), reason);
        return payment;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity revise(PaymentEntity payment, PaymentDetails changes) {
        PaymentDetails current = payment.details();
        payment.revise(new PaymentDetails(
            changes.getMethod() != null ? changes.getMethod() : current.getMethod(),
            changes.getPaymentDate() != null ? changes.getPaymentDate() : current.getPaymentDate(),
            changes.getReferenceNumber() != null ? changes.getReferenceNumber() : current.getReferenceNumber(),
            changes.getNotes() != null ? changes.getNotes() : current.getNotes()));
        return payment;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void discard(PaymentEntity payment) {
        payment.ensureMutable();
        paymentRepository.delete(payment);
        log.info("Payment deleted: paymentId={}, status={}", payment.getId(), payment.getStatus());
    }

    /**
     * Brings a non-paid invoice to PAID. Any outstanding balance is recorded as a
     * completed payment (method OTHER) so that amountPaid still equals the sum of
     * completed payments.
     *
     * @return the settlement payment, empty when nothing was outstanding
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<PaymentEntity> settleOutstanding(InvoiceEntity invoice, Instant now) {
        if (invoice.isPaid()) {
            throw new InvoiceAlreadyPaidException(invoice.getId());
        }
        if (Money.isZero(invoice.getAmountDue())) {
            stateMachine.transition(invoice, InvoiceStatus.PAID, now);
            return Optional.empty();
        }
        PaymentDetails details = new PaymentDetails(
            PaymentMethod.OTHER, LocalDate.ofInstant(now, clock.getZone()), null, SETTLEMENT_NOTE);
        return Optional.of(apply(invoice, invoice.getAmountDue(), details, null, now));
    }

    private BigDecimal checkApplicable(InvoiceEntity invoice, BigDecimal amount) {
        if (invoice.isPaid()) {
            throw new InvoiceAlreadyPaidException(invoice.getId());
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("Payment amount must be greater than zero");
        }
        BigDecimal rounded = Money.round(amount);
        if (rounded.signum() <= 0) {
            throw new InvalidRequestException("Payment amount must be at least 0.01");
        }
        if (rounded.compareTo(invoice.getAmountDue()) > 0) {
            throw new PaymentExceedsAmountDueException(rounded, invoice.getAmountDue());
        }
        return rounded;
    }

    private void credit(InvoiceEntity invoice, BigDecimal amount, Instant now) {
        invoice.creditPayment(amount);
        if (Money.isZero(invoice.getAmountDue())) {
            stateMachine.transition(invoice, InvoiceStatus.PAID, now);
        }
        log.debug("Payment credited: invoiceId={}, amount={}, amountPaid={}, amountDue={}",
            invoice.getId(), amount, invoice.getAmountPaid(), invoice.getAmountDue());
    }
}
