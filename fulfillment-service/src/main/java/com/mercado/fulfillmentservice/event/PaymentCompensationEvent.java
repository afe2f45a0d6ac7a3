package com.mercado.fulfillmentservice.event;

import com.mercado.fulfillmentservice.model.Order;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Money was captured for an order that could not be backed by stock.
 */
@Getter
public class PaymentCompensationEvent extends ApplicationEvent {
    private final Order order;
    private final String reason;
    private final Instant detectedAt;

    public PaymentCompensationEvent(Object source, Order order, String reason, Instant detectedAt) {
        super(source);
        this.order = order;
        this.reason = reason;
        this.detectedAt = detectedAt;
    }
}
