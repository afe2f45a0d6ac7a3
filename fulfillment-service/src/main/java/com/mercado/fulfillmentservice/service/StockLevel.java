package com.mercado.fulfillmentservice.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Physical stock next to the quantity held by active reservations.
 */
@Getter
@AllArgsConstructor
@ToString
public class StockLevel {
    private final UUID productId;
    private final UUID variantId;
    private final int physicalStock;
    private final long reservedQuantity;

    /**
     * Units that can still be reserved. Never negative: a manual stock reduction
     * below the reserved quantity reads as sold out.
     */
    public int getAvailable() {
        return (int) Math.max(0, physicalStock - reservedQuantity);
    }
}
