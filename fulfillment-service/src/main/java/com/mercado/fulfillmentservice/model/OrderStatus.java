package com.mercado.fulfillmentservice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order lifecycle with its adjacency table.
 *
 * <pre>
 * PENDING    -> PAID, CANCELLED
 * PAID       -> CONFIRMED, CANCELLED, REFUNDED
 * CONFIRMED  -> PROCESSING, CANCELLED
 * PROCESSING -> FULFILLED, CANCELLED
 * FULFILLED  -> SHIPPED, CANCELLED
 * SHIPPED    -> DELIVERED, CANCELLED
 * DELIVERED  -> REFUNDED
 * CANCELLED  -> (terminal)
 * REFUNDED   -> (terminal)
 * </pre>
 */
public enum OrderStatus {
    PENDING,
    PAID,
    CONFIRMED,
    PROCESSING,
    FULFILLED,
    SHIPPED,
    DELIVERED,
    CANCELLED,
    REFUNDED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PAID, CANCELLED));
        TRANSITIONS.put(PAID, EnumSet.of(CONFIRMED, CANCELLED, REFUNDED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PROCESSING, CANCELLED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(FULFILLED, CANCELLED));
        TRANSITIONS.put(FULFILLED, EnumSet.of(SHIPPED, CANCELLED));
        TRANSITIONS.put(SHIPPED, EnumSet.of(DELIVERED, CANCELLED));
        TRANSITIONS.put(DELIVERED, EnumSet.of(REFUNDED));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(OrderStatus.class));
    }

    public Set<OrderStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Goods are still in the warehouse: stock deducted for this order can go back on
     * the shelf if the order is cancelled.
     */
    public boolean isBeforeShipment() {
        return this == PENDING || this == PAID || this == CONFIRMED
                || this == PROCESSING || this == FULFILLED;
    }

    /**
     * Payment has been captured at some point in this order's history.
     */
    public boolean isPaymentCaptured() {
        return this != PENDING && this != CANCELLED;
    }
}
