package com.flagship.invoice_ledger.client;

import java.util.UUID;

/**
 * Ownership lookup used by the ledger before an invoice is attached to a client.
 */
public interface ClientDirectory {

    boolean clientBelongsTo(UUID clientId, UUID ownerId);
}
