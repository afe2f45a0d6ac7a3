package com.mercado.fulfillmentservice.service;

/**
 * What happened to a stored webhook event after one processing attempt.
 */
public enum ProcessingResult {
    PROCESSED,
    RETRY_SCHEDULED,
    // failed and out of attempts
    ARCHIVED,
    // not in a processable state (already processed, or archived)
    SKIPPED;

    public boolean isSuccess() {
        return this == PROCESSED;
    }
}
