package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.dto.CheckoutRequest;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.dto.ReservationRequest;
import com.mercado.fulfillmentservice.dto.ReservationResponse;

import java.util.UUID;

/**
 * Entry point for callers that place holds. Lock timeouts and deadlocks are retried
 * here with backoff; when retries run out nothing has been committed.
 */
public interface CheckoutService {

    /**
     * Reserves every line item and creates the PENDING order, all in one transaction.
     * One insufficient line rolls back the holds already placed for the others.
     */
    OrderResponse checkout(CheckoutRequest request, UUID userId);

    /**
     * Places a single hold, e.g. when an item is added to a cart.
     */
    ReservationResponse reserve(ReservationRequest request, String requesterId);
}
