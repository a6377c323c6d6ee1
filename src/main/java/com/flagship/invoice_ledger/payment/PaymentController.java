package com.flagship.invoice_ledger.payment;

import com.flagship.invoice_ledger.ledger.LedgerService;
import com.flagship.invoice_ledger.ledger.PaymentReceipt;
import com.flagship.invoice_ledger.payment.dto.FailPaymentRequest;
import com.flagship.invoice_ledger.payment.dto.PaymentResponse;
import com.flagship.invoice_ledger.payment.dto.RecordPaymentRequest;
import com.flagship.invoice_ledger.payment.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for payments.
 *
 * Recording a payment is idempotent when the caller sends an Idempotency-Key
 * header: a repeated key answers 200 with the original payment instead of 201.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String ACCOUNT_HEADER = "X-Account-Id";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;
    private final PaymentQueryService queryService;

    @PostMapping("/invoices/{invoiceId}/payments")
    public ResponseEntity<PaymentResponse> applyPayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("invoiceId") UUID invoiceId,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        log.info("Received payment request: invoiceId={}, amount={}, method={}, idempotencyKey={}",
            invoiceId, request.getAmount(), request.getMethod(), idempotencyKey);

        PaymentReceipt receipt = ledgerService.applyPayment(invoiceId, ownerId, request, idempotencyKey);
        HttpStatus status = receipt.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(receipt.getPayment()));
    }

    @GetMapping("/invoices/{invoiceId}/payments")
    public ResponseEntity<List<PaymentResponse>> paymentsForInvoice(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(respond(queryService.paymentsForInvoice(invoiceId, ownerId)));
    }

    @PostMapping("/invoices/{invoiceId}/payments/pending")
    public ResponseEntity<PaymentResponse> recordPendingPayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("invoiceId") UUID invoiceId,
            @Valid @RequestBody RecordPaymentRequest request) {
        Payment payment = ledgerService.recordPendingPayment(invoiceId, ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/invoices/{invoiceId}/payments/pending")
    public ResponseEntity<List<PaymentResponse>> pendingPayments(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(respond(queryService.pendingPaymentsForInvoice(invoiceId, ownerId)));
    }

    @GetMapping("/payments/stats")
    public ResponseEntity<PaymentStats> paymentStats(@RequestHeader(ACCOUNT_HEADER) UUID ownerId) {
        return ResponseEntity.ok(queryService.paymentStats(ownerId));
    }

    @GetMapping("/payments/{id}")
    public ResponseEntity<PaymentResponse> getPayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(queryService.findPayment(id, ownerId)));
    }

    @PatchMapping("/payments/{id}")
    public ResponseEntity<PaymentResponse> updatePayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdatePaymentRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(ledgerService.updatePayment(id, ownerId, request)));
    }

    @DeleteMapping("/payments/{id}")
    public ResponseEntity<Void> deletePayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        ledgerService.deletePayment(id, ownerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/payments/{id}/complete")
    public ResponseEntity<PaymentResponse> completePayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id) {
        PaymentReceipt receipt = ledgerService.completePayment(id, ownerId);
        return ResponseEntity.ok(PaymentResponse.from(receipt.getPayment()));
    }

    @PostMapping("/payments/{id}/fail")
    public ResponseEntity<PaymentResponse> failPayment(
            @RequestHeader(ACCOUNT_HEADER) UUID ownerId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody FailPaymentRequest request) {
        return ResponseEntity.ok(PaymentResponse.from(ledgerService.failPayment(id, ownerId, request.getReason())));
    }

    private List<PaymentResponse> respond(List<Payment> payments) {
        return payments.stream().map(PaymentResponse::from).toList();
    }
}
