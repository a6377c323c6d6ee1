package com.flagship.invoice_ledger.invoice;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "invoice_line_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceLineItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    private InvoiceEntity invoice;

    @Column(nullable = false)
    private int position;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal rate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    static InvoiceLineItemEntity priced(InvoiceEntity invoice, int position, LineItem item, BigDecimal amount) {
        return new InvoiceLineItemEntity(
            UUID.randomUUID(),
            invoice,
            position,
            item.getDescription().trim(),
            item.getQuantity(),
            item.getRate(),
            amount
        );
    }

    InvoiceLineItem toDomain() {
        return new InvoiceLineItem(position, description, quantity, rate, amount);
    }
}
