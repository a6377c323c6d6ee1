package com.flagship.invoice_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.payment.PaymentDetails;
import com.flagship.invoice_ledger.payment.PaymentMethod;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Partial update of a pending or failed payment. The amount cannot be changed.
 */
@Value
@Builder
@Jacksonized
public class UpdatePaymentRequest {

    @JsonProperty("method")
    PaymentMethod method;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @Size(max = 255)
    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("notes")
    String notes;

    public PaymentDetails toDetails() {
        return new PaymentDetails(method, paymentDate, referenceNumber, notes);
    }
}
