package com.mercado.fulfillmentservice.dto;

import com.mercado.fulfillmentservice.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class OrderEventResponse {
    private UUID id;
    private OrderStatus previousStatus;
    private OrderStatus newStatus;
    private String actor;
    private String note;
    private Instant createdAt;
}
