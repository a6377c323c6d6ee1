package com.flagship.invoice_ledger.subscription;

import lombok.Value;

import java.util.UUID;

/**
 * A granted unit of quota. {@code used} already includes this reservation.
 */
@Value
public class Reservation {
    UUID ownerId;
    QuotaResource resource;
    int used;
    int limit;

    public int getRemaining() {
        return Math.max(0, limit - used);
    }
}
