package com.flagship.invoice_ledger.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.invoice.Invoice;
import com.flagship.invoice_ledger.invoice.InvoiceDisplayStatus;
import com.flagship.invoice_ledger.invoice.InvoiceLineItem;
import com.flagship.invoice_ledger.invoice.InvoiceStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for invoice operations.
 *
 * Carries both the stored {@code status} and the derived {@code display_status},
 * which reads OVERDUE for unpaid invoices past their due date.
 */
@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("amount_due")
    BigDecimal amountDue;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("display_status")
    InvoiceDisplayStatus displayStatus;

    @JsonProperty("sent_at")
    Instant sentAt;

    @JsonProperty("viewed_at")
    Instant viewedAt;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("terms")
    String terms;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static InvoiceResponse from(Invoice invoice, LocalDate today) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .clientId(invoice.getClientId())
            .issueDate(invoice.getIssueDate())
            .dueDate(invoice.getDueDate())
            .currency(invoice.getCurrency().name())
            .items(invoice.getItems().stream().map(Item::from).toList())
            .subtotal(invoice.getSubtotal())
            .discountAmount(invoice.getDiscountAmount())
            .taxRate(invoice.getTaxRatePercent())
            .taxAmount(invoice.getTaxAmount())
            .total(invoice.getTotal())
            .amountPaid(invoice.getAmountPaid())
            .amountDue(invoice.getAmountDue())
            .status(invoice.getStatus())
            .displayStatus(invoice.displayStatus(today))
            .sentAt(invoice.getSentAt())
            .viewedAt(invoice.getViewedAt())
            .paidAt(invoice.getPaidAt())
            .notes(invoice.getNotes())
            .terms(invoice.getTerms())
            .createdAt(invoice.getCreatedAt())
            .updatedAt(invoice.getUpdatedAt())
            .build();
    }

    @Value
    @Builder
    public static class Item {

        @JsonProperty("description")
        String description;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("rate")
        BigDecimal rate;

        @JsonProperty("amount")
        BigDecimal amount;

        static Item from(InvoiceLineItem item) {
            return Item.builder()
                .description(item.getDescription())
                .quantity(item.getQuantity())
                .rate(item.getRate())
                .amount(item.getAmount())
                .build();
        }
    }
}
