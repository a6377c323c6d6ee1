package com.flagship.invoice_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.payment.Payment;
import com.flagship.invoice_ledger.payment.PaymentMethod;
import com.flagship.invoice_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .invoiceId(payment.getInvoiceId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency().name())
            .method(payment.getMethod())
            .status(payment.getStatus())
            .paymentDate(payment.getPaymentDate())
            .referenceNumber(payment.getReferenceNumber())
            .notes(payment.getNotes())
            .failureReason(payment.getFailureReason())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
