package com.flagship.invoice_ledger.payment;

import com.flagship.invoice_ledger.exception.InvalidStatusTransitionException;
import com.flagship.invoice_ledger.exception.PaymentImmutableException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for a payment against an invoice.
 *
 * Key design principles:
 * - No setters: amount, invoice and owner are fixed at creation
 * - Status only moves PENDING -> COMPLETED | FAILED
 * - A COMPLETED payment rejects every further change with PaymentImmutable
 * - The idempotency key is a persistence concern, unique per owner
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_invoice", columnList = "invoice_id"),
        @Index(name = "idx_payments_owner_status", columnList = "owner_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    @Column(name = "reference_number", length = 255)
    private String referenceNumber;

    @Column(length = 2000)
    private String notes;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "idempotency_key", updatable = false, length = 255)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * A payment that is credited to its invoice in the same transaction.
     * Only the payment engine creates these.
     */
    static PaymentEntity completed(UUID invoiceId, UUID ownerId, BigDecimal amount, CurrencyCode currency,
                                   PaymentDetails details, String idempotencyKey) {
        return create(invoiceId, ownerId, amount, currency, details, PaymentStatus.COMPLETED, idempotencyKey);
    }

    /**
     * A payment awaiting confirmation. Invoice totals are untouched until it completes.
     */
    static PaymentEntity pending(UUID invoiceId, UUID ownerId, BigDecimal amount, CurrencyCode currency,
                                 PaymentDetails details) {
        return create(invoiceId, ownerId, amount, currency, details, PaymentStatus.PENDING, null);
    }

    private static PaymentEntity create(UUID invoiceId, UUID ownerId, BigDecimal amount, CurrencyCode currency,
                                        PaymentDetails details, PaymentStatus status, String idempotencyKey) {
        return new PaymentEntity(
            UUID.randomUUID(),
            invoiceId,
            ownerId,
            amount,
            currency,
            details.getMethod(),
            status,
            details.getPaymentDate(),
            details.getReferenceNumber(),
            details.getNotes(),
            null,
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    void complete() {
        moveTo(PaymentStatus.COMPLETED);
    }

    void fail(String reason) {
        moveTo(PaymentStatus.FAILED);
        this.failureReason = reason;
    }

    /**
     * Replaces the descriptive fields. Amount is never revisable.
     */
    void revise(PaymentDetails details) {
        ensureMutable();
        this.method = details.getMethod();
        this.paymentDate = details.getPaymentDate();
        this.referenceNumber = details.getReferenceNumber();
        this.notes = details.getNotes();
    }

    void ensureMutable() {
        if (status == PaymentStatus.COMPLETED) {
            throw new PaymentImmutableException(id);
        }
    }

    private void moveTo(PaymentStatus target) {
        ensureMutable();
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException("Payment", status, target);
        }
        this.status = target;
    }

    PaymentDetails details() {
        return new PaymentDetails(method, paymentDate, referenceNumber, notes);
    }

    public Payment toDomain() {
        return new Payment(
            id,
            invoiceId,
            ownerId,
            amount,
            currency,
            method,
            status,
            paymentDate,
            referenceNumber,
            notes,
            failureReason,
            createdAt,
            updatedAt
        );
    }
}
