package com.mercado.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Contract for reservation lifecycle events (reservation.committed, reservation.released,
 * reservation.stock_restored). Consumed by the notification dispatcher and by
 * back-in-stock alerting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationChangeContract {
    private UUID reservationId;
    private UUID productId;
    private UUID variantId; // nullable
    private UUID orderId;   // nullable until committed
    private int quantity;
    private String status;
    private Instant occurredAt;
}
