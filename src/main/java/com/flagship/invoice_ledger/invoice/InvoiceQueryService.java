package com.flagship.invoice_ledger.invoice;

import com.flagship.invoice_ledger.exception.NotFoundException;
import com.flagship.invoice_ledger.ledger.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side for invoices. Takes no locks; snapshots are built inside a
 * read-only transaction so line items are loaded before it closes.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InvoiceQueryService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("issueDate"), Sort.Order.desc("createdAt"));

    private final InvoiceRepository invoiceRepository;
    private final Clock clock;

    public Invoice findInvoice(UUID invoiceId, UUID ownerId) {
        return invoiceRepository.findByIdAndOwnerId(invoiceId, ownerId)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
    }

    public List<Invoice> listInvoices(UUID ownerId, InvoiceFilter filter) {
        return invoiceRepository.findAll(filter.toSpecification(ownerId), NEWEST_FIRST).stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    public List<Invoice> overdueInvoices(UUID ownerId) {
        return invoiceRepository.findOverdue(ownerId, InvoiceStatus.PAID, today()).stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    public InvoiceStats invoiceStats(UUID ownerId) {
        Map<InvoiceStatus, Long> counts = new EnumMap<>(InvoiceStatus.class);
        for (InvoiceStatus status : InvoiceStatus.values()) {
            counts.put(status, 0L);
        }
        long totalInvoices = 0;
        BigDecimal invoiced = Money.ZERO;
        BigDecimal paid = Money.ZERO;
        BigDecimal outstanding = Money.ZERO;

        for (Object[] row : invoiceRepository.summarizeByStatus(ownerId)) {
            long count = ((Number) row[1]).longValue();
            counts.put((InvoiceStatus) row[0], count);
            totalInvoices += count;
            invoiced = invoiced.add(amount(row[2]));
            paid = paid.add(amount(row[3]));
            outstanding = outstanding.add(amount(row[4]));
        }

        return InvoiceStats.builder()
            .totalInvoices(totalInvoices)
            .countByStatus(counts)
            .overdueCount(invoiceRepository.countOverdue(ownerId, InvoiceStatus.PAID, today()))
            .totalInvoiced(Money.round(invoiced))
            .totalPaid(Money.round(paid))
            .totalOutstanding(Money.round(outstanding))
            .build();
    }

    private static BigDecimal amount(Object value) {
        return new BigDecimal(String.valueOf(value));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
