package com.mercado.fulfillmentservice.service;

/**
 * Outcome of applying a successful payment to an order.
 */
public enum PaymentConfirmation {
    PAID,
    // order had already moved past PENDING with this payment
    ALREADY_APPLIED,
    // payment taken but the order cannot be backed by stock; refund needed
    COMPENSATION_REQUIRED
}
