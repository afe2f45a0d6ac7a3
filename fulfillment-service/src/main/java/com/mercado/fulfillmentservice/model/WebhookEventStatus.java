package com.mercado.fulfillmentservice.model;

public enum WebhookEventStatus {
    PENDING,   // stored, not yet processed (or claimed by a retry sweep)
    PROCESSED,
    ERROR
}
