package com.mercado.fulfillmentservice.service;

import com.mercado.fulfillmentservice.dto.WebhookRetryResult;
import com.mercado.fulfillmentservice.dto.WebhookRetryStats;

import java.util.UUID;

/**
 * Idempotent intake of payment provider notifications, with retry and archiving
 * for events that could not be applied.
 */
public interface WebhookService {

    /**
     * Verifies, stores and processes one delivery.
     *
     * @param externalEventId provider event id; when null it is read from the payload
     * @throws IllegalArgumentException if the body is not JSON or no event id can be found
     */
    WebhookReceipt receiveEvent(String provider, String externalEventId, String rawPayload, String signature);

    /**
     * Applies a stored PENDING event. Failures are recorded on the event, never thrown.
     */
    ProcessingResult process(UUID webhookEventId);

    WebhookRetryResult retryFailedWebhooks(int batchSize);

    WebhookRetryStats getRetryStats();
}
