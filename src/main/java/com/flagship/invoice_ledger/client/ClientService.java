package com.flagship.invoice_ledger.client;

import com.flagship.invoice_ledger.client.dto.CreateClientRequest;
import com.flagship.invoice_ledger.exception.NotFoundException;
import com.flagship.invoice_ledger.ledger.LedgerTransactions;
import com.flagship.invoice_ledger.ledger.event.ClientCreatedEvent;
import com.flagship.invoice_ledger.observability.CorrelationContext;
import com.flagship.invoice_ledger.outbox.OutboxService;
import com.flagship.invoice_ledger.subscription.QuotaEnforcer;
import com.flagship.invoice_ledger.subscription.QuotaResource;
import com.flagship.invoice_ledger.subscription.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Client records. Creating one consumes a unit of CLIENT quota in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientService implements ClientDirectory {

    private final ClientRepository clientRepository;
    private final QuotaEnforcer quotaEnforcer;
    private final OutboxService outboxService;
    private final LedgerTransactions transactions;

    public Client createClient(UUID ownerId, CreateClientRequest request) {
        try (CorrelationContext.Scope ignored = CorrelationContext.scope(ownerId, null)) {
            return transactions.write("createClient", () -> {
                Reservation reservation = quotaEnforcer.reserve(ownerId, QuotaResource.CLIENT);
                ClientEntity saved = clientRepository.save(ClientEntity.create(
                    ownerId,
                    request.getName().trim(),
                    request.getEmail(),
                    request.getCompany(),
                    request.getAddress(),
                    request.getPhone()));
                clientRepository.flush();

                Client client = saved.toDomain();
                outboxService.record(ClientCreatedEvent.of(client));
                log.info("Client created: clientId={}, clientsRemaining={}", client.getId(), reservation.getRemaining());
                return client;
            });
        }
    }

    @Transactional(readOnly = true)
    public Client findClient(UUID clientId, UUID ownerId) {
        return clientRepository.findByIdAndOwnerId(clientId, ownerId)
            .map(ClientEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Client", clientId));
    }

    @Transactional(readOnly = true)
    public List<Client> listClients(UUID ownerId) {
        return clientRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
            .map(ClientEntity::toDomain)
            .toList();
    }

    @Override
    public boolean clientBelongsTo(UUID clientId, UUID ownerId) {
        return clientRepository.existsByIdAndOwnerId(clientId, ownerId);
    }
}
