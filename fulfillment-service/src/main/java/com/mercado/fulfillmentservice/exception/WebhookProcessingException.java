package com.mercado.fulfillmentservice.exception;

/**
 * A stored webhook event could not be applied (bad payload, unknown type, amount
 * mismatch). Recorded on the event and retried with backoff; never returned to the
 * provider.
 */
public class WebhookProcessingException extends RuntimeException {

    public WebhookProcessingException(String message) {
        super(message);
    }
}
