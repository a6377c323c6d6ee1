package com.flagship.invoice_ledger.client;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ClientRepository extends JpaRepository<ClientEntity, UUID> {

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<ClientEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<ClientEntity> findByOwnerIdOrderByNameAsc(UUID ownerId);
}
