package com.mercado.fulfillmentservice.exception;

/**
 * Stored data contradicts itself, e.g. a reservation linked to another order.
 * Never corrected automatically.
 * HTTP Status: 500 Internal Server Error
 */
public class ConsistencyViolationException extends RuntimeException {

    public ConsistencyViolationException(String message) {
        super(message);
    }
}
