package com.mercado.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract for order status change events.
 *
 * Used for events like:
 * - order.created
 * - order.paid
 * - order.shipped
 * - order.cancelled
 *
 * Contains all information the notification dispatcher needs for emails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangeContract {
    private UUID orderId;
    private UUID userId;
    private String previousStatus; // null for order.created
    private String status;
    private String actor;
    private String note;
    private BigDecimal totalPrice;
    private Instant changedAt;
}
