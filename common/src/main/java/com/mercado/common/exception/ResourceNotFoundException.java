package com.mercado.common.exception;

/**
 * Exception thrown when a product, variant, reservation, order or webhook event does not exist.
 * Kept distinct from {@link InsufficientStockException}: a missing product will not
 * appear on retry, a sold-out one might.
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
