package com.mercado.fulfillmentservice.dto;

import com.mercado.fulfillmentservice.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private UUID userId;
    private List<OrderItemResponse> items;
    private BigDecimal totalPrice;
    private OrderStatus status;
    private Set<OrderStatus> allowedTransitions;
    private String paymentReference;
    private boolean compensationRequired;
    private Instant paidAt;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;
    private Instant refundedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
