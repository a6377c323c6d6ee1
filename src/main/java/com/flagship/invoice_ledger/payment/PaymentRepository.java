package com.flagship.invoice_ledger.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    /**
     * Resolves the invoice to lock before a payment is touched, without loading
     * the payment into the persistence context ahead of the lock.
     */
    @Query("SELECT p.invoiceId FROM PaymentEntity p WHERE p.id = :id AND p.ownerId = :ownerId")
    Optional<UUID> findInvoiceIdByIdAndOwnerId(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    /**
     * Used for idempotency checking. Keys are unique per owner.
     */
    Optional<PaymentEntity> findByOwnerIdAndIdempotencyKey(UUID ownerId, String idempotencyKey);

    List<PaymentEntity> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);

    List<PaymentEntity> findByInvoiceIdAndStatus(UUID invoiceId, PaymentStatus status);

    boolean existsByInvoiceIdAndStatusNot(UUID invoiceId, PaymentStatus status);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PaymentEntity p WHERE p.invoiceId = :invoiceId AND p.status = :status")
    BigDecimal sumAmountByInvoiceIdAndStatus(@Param("invoiceId") UUID invoiceId, @Param("status") PaymentStatus status);

    @Query("""
        SELECT p.status, COUNT(p), SUM(p.amount)
        FROM PaymentEntity p
        WHERE p.ownerId = :ownerId
        GROUP BY p.status
        """)
    List<Object[]> summarizeByStatus(@Param("ownerId") UUID ownerId);
}
