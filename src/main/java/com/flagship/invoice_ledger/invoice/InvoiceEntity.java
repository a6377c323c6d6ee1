package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.exception.InvalidRequestException;
import com.flagship.invoice_ledger.ledger.Money;
import com.flagship.invoice_ledger.payment.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for an invoice and its priced line items.
 *
 * Key design principles:
 * - No setters: totals only change through {@link #reprice}, amountPaid only
 *   through {@link #creditPayment}, status only through the state machine
 *   (package-private mark* methods)
 * - amountDue is always recomputed as total - amountPaid, never assigned
 * - Optimistic @Version on top of the row lock taken by every mutation
 *
 * Mutating methods must only be called on an instance loaded with
 * {@link InvoiceRepository#findByIdForUpdate}.
 */
@Entity
@Table(
    name = "invoices",
    indexes = {
        @Index(name = "idx_invoices_owner_status", columnList = "owner_id, status"),
        @Index(name = "idx_invoices_owner_due_date", columnList = "owner_id, due_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "client_id", nullable = false)
    private UUID clientId;

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 32)
    private String invoiceNumber;

    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "tax_rate_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal taxRatePercent;

    @Column(name = "discount_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal discountAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(name = "amount_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "amount_due", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountDue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "viewed_at")
    private Instant viewedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(length = 2000)
    private String notes;

    @Column(length = 2000)
    private String terms;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    @BatchSize(size = 50)
    private List<InvoiceLineItemEntity> items = new ArrayList<>();

    @Version
    @Column(nullable = false)
    private long version;

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
     * Creates a new DRAFT invoice with nothing paid.
     */
    static InvoiceEntity draft(UUID ownerId, UUID clientId, String invoiceNumber,
                               LocalDate issueDate, LocalDate dueDate, CurrencyCode currency,
                               String notes, String terms,
                               List<LineItem> lineItems, InvoiceTotals totals) {
        InvoiceEntity invoice = new InvoiceEntity();
        invoice.id = UUID.randomUUID();
        invoice.ownerId = ownerId;
        invoice.clientId = clientId;
        invoice.invoiceNumber = invoiceNumber;
        invoice.issueDate = issueDate;
        invoice.dueDate = dueDate;
        invoice.currency = currency;
        invoice.notes = notes;
        invoice.terms = terms;
        invoice.status = InvoiceStatus.DRAFT;
        invoice.amountPaid = Money.ZERO;
        invoice.reprice(lineItems, totals);
        return invoice;
    }

    /**
     * Replaces line items and totals. amountDue follows from the new total.
     *
     * @throws InvalidRequestException if the new total is below what has already been paid
     */
    void reprice(List<LineItem> lineItems, InvoiceTotals totals) {
        if (totals.getTotal().compareTo(amountPaid) < 0) {
            throw new InvalidRequestException(String.format(
                "New total %s is below the amount already paid %s",
                totals.getTotal().toPlainString(), amountPaid.toPlainString()));
        }
        items.clear();
        for (int i = 0; i < lineItems.size(); i++) {
            items.add(InvoiceLineItemEntity.priced(this, i, lineItems.get(i), totals.getLineAmounts().get(i)));
        }
        this.subtotal = totals.getSubtotal();
        this.discountAmount = totals.getDiscountAmount();
        this.taxRatePercent = totals.getTaxRatePercent();
        this.taxAmount = totals.getTaxAmount();
        this.total = totals.getTotal();
        this.amountDue = total.subtract(amountPaid);
    }

    void reassignClient(UUID clientId) {
        this.clientId = clientId;
    }

    void reschedule(LocalDate issueDate, LocalDate dueDate) {
        this.issueDate = issueDate;
        this.dueDate = dueDate;
    }

    void changeCurrency(CurrencyCode currency) {
        this.currency = currency;
    }

    void updateNotes(String notes, String terms) {
        this.notes = notes;
        this.terms = terms;
    }

    /**
     * Adds a completed payment to amountPaid. The caller has already checked
     * that the amount is positive and does not exceed amountDue.
     */
    public void creditPayment(BigDecimal amount) {
        this.amountPaid = amountPaid.add(amount);
        this.amountDue = total.subtract(amountPaid);
    }

    void markSent(Instant at) {
        this.status = InvoiceStatus.SENT;
        this.sentAt = at;
    }

    void markViewed(Instant at) {
        this.status = InvoiceStatus.VIEWED;
        if (viewedAt == null) {
            this.viewedAt = at;
        }
    }

    void markPaid(Instant at) {
        this.status = InvoiceStatus.PAID;
        this.amountDue = Money.ZERO;
        this.paidAt = at;
    }

    public List<LineItem> lineItems() {
        return items.stream().map(item -> item.toDomain().toLineItem()).toList();
    }

    public boolean isPaid() {
        return status == InvoiceStatus.PAID;
    }

    public Invoice toDomain() {
        return new Invoice(
            id,
            ownerId,
            clientId,
            invoiceNumber,
            issueDate,
            dueDate,
            currency,
            taxRatePercent,
            discountAmount,
            subtotal,
            taxAmount,
            total,
            amountPaid,
            amountDue,
            status,
            sentAt,
            viewedAt,
            paidAt,
            notes,
            terms,
            items.stream().map(InvoiceLineItemEntity::toDomain).toList(),
            version,
            createdAt,
            updatedAt
        );
    }
}
