package com.flagship.invoice_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.payment.PaymentDetails;
import com.flagship.invoice_ledger.payment.PaymentMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for recording a payment against an invoice.
 * Positivity and the amount-due ceiling are checked by the payment engine.
 */
@Value
@Builder
@Jacksonized
public class RecordPaymentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @Size(max = 255)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    public PaymentDetails toDetails(LocalDate defaultDate) {
        return new PaymentDetails(method, paymentDate != null ? paymentDate : defaultDate, referenceNumber, notes);
    }
}
