package com.mercado.fulfillmentservice.dto;

import com.mercado.fulfillmentservice.model.ReservationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ReservationResponse {
    private UUID id;
    private UUID productId;
    private UUID variantId;
    private Integer quantity;
    private ReservationStatus status;
    private UUID orderId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant resolvedAt;
}
