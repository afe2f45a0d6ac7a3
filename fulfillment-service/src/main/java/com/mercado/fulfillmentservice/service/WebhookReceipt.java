package com.mercado.fulfillmentservice.service;

public enum WebhookReceipt {
    ACCEPTED,
    DUPLICATE_IGNORED,
    INVALID_SIGNATURE,
    // signed, but unreadable or without an event id; kept as an archived audit row
    MALFORMED_PAYLOAD
}
