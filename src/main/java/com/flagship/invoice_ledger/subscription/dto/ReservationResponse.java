package com.flagship.invoice_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.subscription.QuotaResource;
import com.flagship.invoice_ledger.subscription.Reservation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReservationResponse {

    @JsonProperty("resource")
    QuotaResource resource;

    @JsonProperty("used")
    int used;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("remaining")
    int remaining;

    public static ReservationResponse from(Reservation reservation) {
        return ReservationResponse.builder()
            .resource(reservation.getResource())
            .used(reservation.getUsed())
            .limit(reservation.getLimit())
            .remaining(reservation.getRemaining())
            .build();
    }
}
