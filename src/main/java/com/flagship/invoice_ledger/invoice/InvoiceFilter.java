package com.flagship.invoice_ledger.invoice;

import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Optional criteria for listing an owner's invoices. Null fields do not filter.
 * The issue-date range is inclusive on both ends.
 */
@Value
@Builder
public class InvoiceFilter {
    InvoiceStatus status;
    UUID clientId;
    LocalDate issuedFrom;
    LocalDate issuedTo;

    public static InvoiceFilter none() {
        return InvoiceFilter.builder().build();
    }

    Specification<InvoiceEntity> toSpecification(UUID ownerId) {
        Specification<InvoiceEntity> spec = (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (clientId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("clientId"), clientId));
        }
        if (issuedFrom != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("issueDate"), issuedFrom));
        }
        if (issuedTo != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("issueDate"), issuedTo));
        }
        return spec;
    }
}
