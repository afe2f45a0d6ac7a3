package com.mercado.fulfillmentservice.exception;

import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * Payment arrived but at least one hold backing the order was no longer active
 * (expired or released). Nothing of the PAID transition is kept.
 * HTTP Status: 409 Conflict
 */
@Getter
public class ReservationCommitException extends RuntimeException {

    private final UUID orderId;
    private final List<UUID> failedReservationIds;

    public ReservationCommitException(UUID orderId, List<UUID> failedReservationIds) {
        super("Could not commit reservations " + failedReservationIds + " for order " + orderId);
        this.orderId = orderId;
        this.failedReservationIds = List.copyOf(failedReservationIds);
    }
}
