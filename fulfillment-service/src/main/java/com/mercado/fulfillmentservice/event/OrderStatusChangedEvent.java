package com.mercado.fulfillmentservice.event;

import com.mercado.fulfillmentservice.model.Order;
import com.mercado.fulfillmentservice.model.OrderStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published inside the transaction that changed the order. The listener writes it
 * to the outbox, so it is only ever sent if that transaction commits.
 */
@Getter
public class OrderStatusChangedEvent extends ApplicationEvent {
    private final Order order;
    private final OrderStatus previousStatus; // null when the order was just created
    private final String actor;
    private final String note;
    private final Instant changedAt;

    public OrderStatusChangedEvent(Object source, Order order, OrderStatus previousStatus,
                                   String actor, String note, Instant changedAt) {
        super(source);
        this.order = order;
        this.previousStatus = previousStatus;
        this.actor = actor;
        this.note = note;
        this.changedAt = changedAt;
    }

    public String getRoutingKey() {
        return previousStatus == null
                ? "order.created"
                : "order." + order.getStatus().name().toLowerCase();
    }
}
