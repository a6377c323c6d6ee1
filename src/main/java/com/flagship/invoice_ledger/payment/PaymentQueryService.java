package com.flagship.invoice_ledger.payment;

import com.flagship.invoice_ledger.exception.NotFoundException;
import com.flagship.invoice_ledger.invoice.InvoiceRepository;
import com.flagship.invoice_ledger.ledger.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PaymentQueryService {

    private final PaymentRepository paymentRepository;
    private final InvoiceRepository invoiceRepository;

    public Payment findPayment(UUID paymentId, UUID ownerId) {
        return paymentRepository.findByIdAndOwnerId(paymentId, ownerId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId));
    }

    public List<Payment> paymentsForInvoice(UUID invoiceId, UUID ownerId) {
        requireInvoice(invoiceId, ownerId);
        return paymentRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    public List<Payment> pendingPaymentsForInvoice(UUID invoiceId, UUID ownerId) {
        requireInvoice(invoiceId, ownerId);
        return paymentRepository.findByInvoiceIdAndStatus(invoiceId, PaymentStatus.PENDING).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Sum of COMPLETED payments; always equal to the invoice's amountPaid.
     */
    public BigDecimal completedTotal(UUID invoiceId, UUID ownerId) {
        requireInvoice(invoiceId, ownerId);
        return Money.round(paymentRepository.sumAmountByInvoiceIdAndStatus(invoiceId, PaymentStatus.COMPLETED));
    }

    public PaymentStats paymentStats(UUID ownerId) {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        Map<PaymentStatus, BigDecimal> sums = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, 0L);
            sums.put(status, Money.ZERO);
        }
        long total = 0;
        for (Object[] row : paymentRepository.summarizeByStatus(ownerId)) {
            PaymentStatus status = (PaymentStatus) row[0];
            long count = ((Number) row[1]).longValue();
            counts.put(status, count);
            sums.put(status, Money.round(new BigDecimal(String.valueOf(row[2]))));
            total += count;
        }

        long completed = counts.get(PaymentStatus.COMPLETED);
        BigDecimal completedAmount = sums.get(PaymentStatus.COMPLETED);
        BigDecimal average = completed == 0
            ? Money.ZERO
            : completedAmount.divide(BigDecimal.valueOf(completed), Money.SCALE, RoundingMode.HALF_UP);

        return PaymentStats.builder()
            .totalPayments(total)
            .countByStatus(counts)
            .totalCompletedAmount(completedAmount)
            .averageCompletedAmount(average)
            .totalPendingAmount(sums.get(PaymentStatus.PENDING))
            .build();
    }

    private void requireInvoice(UUID invoiceId, UUID ownerId) {
        if (invoiceRepository.findByIdAndOwnerId(invoiceId, ownerId).isEmpty()) {
            throw new NotFoundException("Invoice", invoiceId);
        }
    }
}
