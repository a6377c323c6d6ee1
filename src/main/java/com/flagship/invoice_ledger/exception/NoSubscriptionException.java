package com.flagship.invoice_ledger.exception;

import java.util.UUID;

public class NoSubscriptionException extends LedgerException {

    public NoSubscriptionException(UUID ownerId) {
        super(ErrorKind.NO_SUBSCRIPTION, "No subscription found for account " + ownerId);
    }
}
