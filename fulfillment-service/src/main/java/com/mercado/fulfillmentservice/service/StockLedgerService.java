package com.mercado.fulfillmentservice.service;

import java.util.UUID;

/**
 * Derived view of sellable stock: physical units minus active holds.
 *
 * A {@code null} variantId always means "the product itself"; holds on variants are
 * never counted against the product row and vice versa.
 */
public interface StockLedgerService {

    /**
     * Units available to reserve right now. Read-only.
     *
     * @throws com.mercado.common.exception.ResourceNotFoundException if the product, or
     *         the variant under that product, does not exist
     */
    int getAvailableStock(UUID productId, UUID variantId);

    StockLevel getStockLevel(UUID productId, UUID variantId);

    /**
     * Same read as {@link #getStockLevel}, taken after a write lock on the product
     * (or variant) row. The lock lives until the surrounding transaction ends, so
     * this must be called inside one.
     */
    StockLevel lockStock(UUID productId, UUID variantId);

    /**
     * Deducts physical stock when a hold is converted into a sale.
     */
    void deductPhysicalStock(UUID productId, UUID variantId, int quantity);

    /**
     * Puts units back on the shelf (manual restock or compensating restoration).
     */
    void addPhysicalStock(UUID productId, UUID variantId, int quantity);
}
