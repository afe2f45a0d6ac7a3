package com.mercado.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(nullable = false)
    @ToString.Include
    private UUID productId;

    private UUID variantId;

    // name and price are snapshots taken at checkout
    @Column(nullable = false)
    private String productName;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false)
    private BigDecimal price;

    // hold backing this line
    @Column(name = "reservation_id", nullable = false)
    private UUID reservationId;

    // committed stock for this line was put back after a cancellation or refund
    @Column(name = "stock_restored", nullable = false)
    private boolean stockRestored;
}
