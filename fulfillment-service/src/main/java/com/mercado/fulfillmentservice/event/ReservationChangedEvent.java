package com.mercado.fulfillmentservice.event;

import com.mercado.fulfillmentservice.model.Reservation;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

@Getter
public class ReservationChangedEvent extends ApplicationEvent {
    private final Reservation reservation;
    private final String routingKey;
    private final Instant occurredAt;

    public ReservationChangedEvent(Object source, Reservation reservation, String routingKey, Instant occurredAt) {
        super(source);
        this.reservation = reservation;
        this.routingKey = routingKey;
        this.occurredAt = occurredAt;
    }
}
