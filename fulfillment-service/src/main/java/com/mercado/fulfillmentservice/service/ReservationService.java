package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.model.Reservation;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-bounded holds on stock.
 *
 * Every status change is a conditional update out of ACTIVE. Methods that lose a
 * race return {@code false} instead of throwing: a late confirmation or a double
 * release is an expected outcome, not an error.
 */
public interface ReservationService {

    /**
     * Places a hold if enough unreserved stock exists.
     *
     * @throws com.mercado.common.exception.InsufficientStockException with the units still available
     * @throws com.mercado.common.exception.ResourceNotFoundException for an unknown product or variant
     * @throws IllegalArgumentException for a non-positive quantity or a blank requester
     */
    Reservation createReservation(UUID productId, UUID variantId, int quantity, String requesterId);

    /**
     * Converts an active hold into a physical stock deduction for the given order.
     *
     * @return false if the hold is no longer active
     * @throws com.mercado.fulfillmentservice.exception.ConsistencyViolationException if the
     *         hold belongs to a different order
     */
    boolean commitReservation(UUID reservationId, UUID orderId);

    boolean releaseReservation(UUID reservationId);

    /**
     * Expires every active hold whose deadline is at or before {@code now}.
     *
     * @return number of holds expired
     */
    int expireStaleReservations(Instant now);

    /**
     * Pushes the deadline of an active hold further out. A hold never lives past
     * {@code createdAt + ttl + maxExtension}, however many times it is extended.
     *
     * @throws com.mercado.fulfillmentservice.exception.ReservationNotActiveException if the hold already ended
     *         or its deadline has passed
     * @throws IllegalArgumentException if the new deadline would pass the lifetime cap
     */
    Reservation extendReservation(UUID reservationId, Duration extra);

    /**
     * Puts the units of a committed hold back into physical stock. Used when a paid
     * order is cancelled or refunded before shipment.
     *
     * @return false if the hold was never committed
     */
    boolean restoreCommittedStock(UUID reservationId);

    void restock(UUID productId, UUID variantId, int quantity);

    Reservation getReservation(UUID reservationId);
}
