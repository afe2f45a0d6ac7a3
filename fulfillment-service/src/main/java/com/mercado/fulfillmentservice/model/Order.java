package com.mercado.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // customer who checked out (JWT subject)
    @Column(nullable = false)
    private UUID userId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @ToString.Include
    private OrderStatus status;

    // provider-side reference of the captured payment
    @Column(name = "payment_reference")
    private String paymentReference;

    // Set when money was captured but the reservations could not be committed.
    // Finance picks these up for refund.
    @Column(name = "compensation_required", nullable = false)
    private boolean compensationRequired;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "processing_at")
    private Instant processingAt;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking on top of the row lock taken by the state machine:
    // a stale admin form cannot overwrite a newer status.
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Stamps the timestamp column that belongs to the given status.
     */
    public void stampStatusTimestamp(OrderStatus target, Instant at) {
        switch (target) {
            case PAID -> paidAt = at;
            case CONFIRMED -> confirmedAt = at;
            case PROCESSING -> processingAt = at;
            case FULFILLED -> fulfilledAt = at;
            case SHIPPED -> shippedAt = at;
            case DELIVERED -> deliveredAt = at;
            case CANCELLED -> cancelledAt = at;
            case REFUNDED -> refundedAt = at;
            case PENDING -> {
                // assigned at creation, createdAt covers it
            }
        }
    }

    public Instant getStatusTimestamp(OrderStatus status) {
        return switch (status) {
            case PENDING -> createdAt;
            case PAID -> paidAt;
            case CONFIRMED -> confirmedAt;
            case PROCESSING -> processingAt;
            case FULFILLED -> fulfilledAt;
            case SHIPPED -> shippedAt;
            case DELIVERED -> deliveredAt;
            case CANCELLED -> cancelledAt;
            case REFUNDED -> refundedAt;
        };
    }
}
