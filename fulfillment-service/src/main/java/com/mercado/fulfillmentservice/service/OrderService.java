package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.dto.OrderEventResponse;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.model.OrderStatus;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    /**
     * Moves an order along its lifecycle.
     * When a PAID transition fails because a hold ran out, the order is cancelled and
     * flagged for refund before the failure is rethrown.
     */
    OrderResponse updateStatus(UUID orderId, OrderStatus target, String actor, String note);

    /**
     * Applies a successful payment. Never throws for late payments: those end up as
     * {@link PaymentConfirmation#COMPENSATION_REQUIRED}.
     */
    PaymentConfirmation confirmPayment(UUID orderId, String paymentReference, String actor);

    /**
     * Customer-initiated cancellation. Only the owner may cancel.
     */
    OrderResponse cancelOrder(UUID orderId, UUID userId);

    /**
     * Retrieves an order. Non-null {@code userId} restricts access to the owner.
     */
    OrderResponse getOrder(UUID orderId, UUID userId);

    List<OrderResponse> getOrdersForUser(UUID userId);

    /**
     * Audit trail of the order, oldest first.
     */
    List<OrderEventResponse> getOrderHistory(UUID orderId, UUID userId);
}
