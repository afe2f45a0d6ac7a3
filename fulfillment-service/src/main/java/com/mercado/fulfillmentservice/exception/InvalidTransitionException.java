package com.mercado.fulfillmentservice.exception;

import com.mercado.fulfillmentservice.model.OrderStatus;
import lombok.Getter;

import java.util.Set;
import java.util.UUID;

/**
 * Thrown when a status change is not an edge of the order lifecycle.
 * HTTP Status: 422 Unprocessable Entity, with the legal next statuses in the body.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID orderId;
    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;
    private final Set<OrderStatus> legalNextStatuses;

    public InvalidTransitionException(UUID orderId, OrderStatus currentStatus, OrderStatus requestedStatus) {
        super("Order " + orderId + " cannot move from " + currentStatus + " to " + requestedStatus);
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
        this.legalNextStatuses = currentStatus.allowedTransitions();
    }
}
