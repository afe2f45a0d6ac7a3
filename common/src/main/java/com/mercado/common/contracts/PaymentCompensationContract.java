package com.mercado.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract for 'order.payment_compensation_required'.
 *
 * Emitted when a payment was confirmed for an order whose reservations had already
 * expired or been released. The customer was charged but no stock backs the order,
 * so finance has to refund it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentCompensationContract {
    private UUID orderId;
    private UUID userId;
    private String paymentReference;
    private BigDecimal amount;
    private String reason;
    private Instant detectedAt;
}
