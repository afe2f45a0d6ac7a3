package com.mercado.common.exception;

/**
 * Exception thrown when a reservation asks for more units than are available to sell.
 * This is an expected race outcome, not a fault: the remaining quantity is carried
 * so the client can show it.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InsufficientStockException extends RuntimeException {

    private final int availableStock;

    public InsufficientStockException(String message, int availableStock) {
        super(message);
        this.availableStock = availableStock;
    }

    public int getAvailableStock() {
        return availableStock;
    }
}
