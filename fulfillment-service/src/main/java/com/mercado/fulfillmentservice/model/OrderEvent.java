package com.mercado.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit trail row, one per applied status transition. Insert-only.
 */
@Entity
@Immutable
@Table(name = "order_events", indexes = @Index(name = "idx_order_events_order", columnList = "order_id, created_at"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    // null for the creation event
    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", updatable = false)
    private OrderStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, updatable = false)
    private OrderStatus newStatus;

    @Column(nullable = false, updatable = false)
    private String actor;

    @Column(length = 1000, updatable = false)
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
