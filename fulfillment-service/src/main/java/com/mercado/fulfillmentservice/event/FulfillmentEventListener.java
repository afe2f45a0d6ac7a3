package com.mercado.fulfillmentservice.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mercado.common.contracts.OrderStatusChangeContract;
import com.mercado.common.contracts.PaymentCompensationContract;
import com.mercado.common.contracts.ReservationChangeContract;
import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OutboxEvent;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Turns domain events into outbox rows.
 *
 * Runs synchronously in the publisher's transaction: a failure here rolls the
 * state change back, and a rolled back state change leaves no notification behind.
 * OutboxPublisher sends the rows to RabbitMQ later.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FulfillmentEventListener {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @EventListener
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        Order order = event.getOrder();
        OrderStatusChangeContract contract = OrderStatusChangeContract.builder()
                .orderId(order.getId())
                .userId(order.getUserId())
                .previousStatus(event.getPreviousStatus() != null ? event.getPreviousStatus().name() : null)
                .status(order.getStatus().name())
                .actor(event.getActor())
                .note(event.getNote())
                .totalPrice(order.getTotalPrice())
                .changedAt(event.getChangedAt())
                .build();

        saveOutboxEvent("ORDER", order.getId().toString(), event.getRoutingKey(), contract);
        log.info("Saved order event to Outbox: orderId={}, routingKey={}", order.getId(), event.getRoutingKey());
    }

    @EventListener
    public void handleReservationChanged(ReservationChangedEvent event) {
        Reservation reservation = event.getReservation();
        ReservationChangeContract contract = ReservationChangeContract.builder()
                .reservationId(reservation.getId())
                .productId(reservation.getProductId())
                .variantId(reservation.getVariantId())
                .orderId(reservation.getOrderId())
                .quantity(reservation.getQuantity())
                .status(reservation.getStatus().name())
                .occurredAt(event.getOccurredAt())
                .build();

        saveOutboxEvent("RESERVATION", reservation.getId().toString(), event.getRoutingKey(), contract);
        log.debug("Saved reservation event to Outbox: reservationId={}, routingKey={}",
                reservation.getId(), event.getRoutingKey());
    }

    @EventListener
    public void handlePaymentCompensation(PaymentCompensationEvent event) {
        Order order = event.getOrder();
        PaymentCompensationContract contract = PaymentCompensationContract.builder()
                .orderId(order.getId())
                .userId(order.getUserId())
                .paymentReference(order.getPaymentReference())
                .amount(order.getTotalPrice())
                .reason(event.getReason())
                .detectedAt(event.getDetectedAt())
                .build();

        saveOutboxEvent("ORDER", order.getId().toString(), "order.payment_compensation_required", contract);
        log.warn("Saved payment compensation event to Outbox: orderId={}, paymentReference={}",
                order.getId(), order.getPaymentReference());
    }

    private void saveOutboxEvent(String aggregateType, String aggregateId, String type, Object payloadObj) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payloadObj);
        } catch (JsonProcessingException e) {
            // rolls back the caller's transaction
            throw new IllegalStateException("Failed to serialize outbox event " + type, e);
        }

        OutboxEvent outboxEvent = OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .type(type)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .processed(false)
                .build();
        outboxRepository.save(outboxEvent);
    }
}
