package com.mercado.fulfillmentservice.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID productId;
    private UUID variantId;
    private String productName;
    private Integer quantity;
    private BigDecimal price; // unit price at checkout
    private UUID reservationId;
}
