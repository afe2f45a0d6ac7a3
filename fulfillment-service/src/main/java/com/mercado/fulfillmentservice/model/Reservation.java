package com.mercado.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * A time-bounded hold on stock.
 *
 * Quantity, product and variant never change after insert. Status moves only out of
 * ACTIVE, and only through the conditional updates in ReservationRepository, so a
 * commit racing the expiry sweep can never both win.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "inventory_reservations", indexes = {
        @Index(name = "idx_reservation_stock_status", columnList = "product_id, variant_id, status"),
        @Index(name = "idx_reservation_status_expiry", columnList = "status, expires_at"),
        @Index(name = "idx_reservation_order", columnList = "order_id")
})
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "product_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID productId;

    @Column(name = "variant_id", updatable = false)
    private UUID variantId;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private Integer quantity;

    // user id, or the anonymous session id for guest checkouts
    @Column(name = "requester_id", nullable = false, updatable = false)
    private String requesterId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    // when the hold left ACTIVE
    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "order_id")
    private UUID orderId;

    public boolean isActive() {
        return status == ReservationStatus.ACTIVE;
    }
}
