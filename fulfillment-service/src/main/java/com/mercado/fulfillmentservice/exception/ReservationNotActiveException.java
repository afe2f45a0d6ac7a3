package com.mercado.fulfillmentservice.exception;

import java.util.UUID;

/**
 * HTTP Status: 409 Conflict
 */
public class ReservationNotActiveException extends RuntimeException {

    public ReservationNotActiveException(UUID reservationId) {
        super("Reservation " + reservationId + " is no longer active");
    }
}
