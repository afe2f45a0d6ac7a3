package com.mercado.fulfillmentservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class StockResponse {
    private UUID productId;
    private UUID variantId;
    private int physicalStock;
    private long reservedQuantity;
    private int available;
}
