package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.dto.PaymentEventPayload;
import com.mercado.fulfillmentservice.exception.WebhookProcessingException;
import com.mercado.fulfillmentservice.model.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Maps a provider notification onto an order transition.
 *
 * <ul>
 *   <li>payment.succeeded / completed: confirm payment (commits the holds)</li>
 *   <li>payment.failed / failed: cancel a PENDING order (releases the holds)</li>
 *   <li>refund.succeeded / refunded: move to REFUNDED</li>
 *   <li>payment.pending / pending: nothing to do</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventHandler {

    // provider amounts are decimal strings; half a cent covers their rounding
    private static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.005");

    private final OrderService orderService;

    public void handle(String provider, PaymentEventPayload payload) {
        UUID orderId = payload.getOrderId();
        if (orderId == null) {
            throw new WebhookProcessingException("Payload carries no orderId");
        }
        String kind = payload.resolveKind();
        if (kind == null) {
            throw new WebhookProcessingException("Payload carries neither type nor status");
        }
        String actor = "webhook:" + provider;

        switch (kind) {
            case "payment.succeeded", "payment.completed", "completed", "succeeded" -> {
                OrderResponse order = orderService.getOrder(orderId, null);
                verifyAmount(order, payload.getAmount());
                PaymentConfirmation confirmation =
                        orderService.confirmPayment(orderId, payload.getPaymentReference(), actor);
                log.info("Payment applied: orderId={}, provider={}, result={}", orderId, provider, confirmation);
            }
            case "payment.failed", "failed" -> {
                OrderResponse order = orderService.getOrder(orderId, null);
                if (order.getStatus() == OrderStatus.PENDING) {
                    orderService.updateStatus(orderId, OrderStatus.CANCELLED, actor, "Payment failed");
                } else {
                    // a failure report can trail a success for the same order
                    log.warn("Ignoring payment failure for non-pending order: orderId={}, status={}",
                            orderId, order.getStatus());
                }
            }
            case "refund.succeeded", "refunded" ->
                    orderService.updateStatus(orderId, OrderStatus.REFUNDED, actor, "Refund confirmed by provider");
            case "payment.pending", "pending" ->
                    log.debug("Payment still pending: orderId={}, provider={}", orderId, provider);
            default -> throw new WebhookProcessingException("Unsupported payment event type: " + kind);
        }
    }

    private void verifyAmount(OrderResponse order, BigDecimal amount) {
        if (amount == null) {
            return;
        }
        if (amount.subtract(order.getTotalPrice()).abs().compareTo(AMOUNT_TOLERANCE) > 0) {
            log.warn("Payment amount mismatch: orderId={}, expected={}, received={}",
                    order.getId(), order.getTotalPrice(), amount);
            throw new WebhookProcessingException("Amount " + amount + " does not match order total "
                    + order.getTotalPrice());
        }
    }
}
