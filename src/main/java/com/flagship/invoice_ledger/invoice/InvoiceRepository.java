package com.flagship.invoice_ledger.invoice;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID>, JpaSpecificationExecutor<InvoiceEntity> {

    /**
     * Loads the invoice holding a row lock (SELECT ... FOR UPDATE) until the
     * surrounding transaction ends. Every mutation of an invoice goes through here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvoiceEntity i WHERE i.id = :id")
    Optional<InvoiceEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<InvoiceEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Query("""
        SELECT i FROM InvoiceEntity i
        WHERE i.ownerId = :ownerId AND i.status <> :paid AND i.dueDate < :today
        ORDER BY i.dueDate ASC
        """)
    List<InvoiceEntity> findOverdue(@Param("ownerId") UUID ownerId,
                                    @Param("paid") InvoiceStatus paid,
                                    @Param("today") LocalDate today);

    @Query("""
        SELECT i.status, COUNT(i), SUM(i.total), SUM(i.amountPaid), SUM(i.amountDue)
        FROM InvoiceEntity i
        WHERE i.ownerId = :ownerId
        GROUP BY i.status
        """)
    List<Object[]> summarizeByStatus(@Param("ownerId") UUID ownerId);

    @Query("""
        SELECT COUNT(i) FROM InvoiceEntity i
        WHERE i.ownerId = :ownerId AND i.status <> :paid AND i.dueDate < :today
        """)
    long countOverdue(@Param("ownerId") UUID ownerId,
                      @Param("paid") InvoiceStatus paid,
                      @Param("today") LocalDate today);
}
