package com.mercado.fulfillmentservice.model;

public enum ReservationStatus {
    ACTIVE,     // holding stock, counted by the ledger
    COMMITTED,  // converted into a physical stock deduction for a paid order
    RELEASED,   // cancelled explicitly before expiry
    EXPIRED;    // reclaimed by the expiry sweep

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
