package com.mercado.fulfillmentservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Body of a payment provider notification. Providers disagree on naming, so both
 * {@code type} ("payment.succeeded") and {@code status} ("completed") are read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentEventPayload {
    private String eventId;
    private String type;
    private String status;
    private UUID orderId;
    private String paymentReference;
    private BigDecimal amount;
    private String currency;
    private Map<String, Object> meta;

    /**
     * Event id as sent by the provider: top-level, then {@code meta.eventId}, then the
     * payment reference.
     */
    public String resolveEventId() {
        if (eventId != null && !eventId.isBlank()) {
            return eventId;
        }
        if (meta != null && meta.get("eventId") instanceof String metaEventId && !metaEventId.isBlank()) {
            return metaEventId;
        }
        return paymentReference;
    }

    /**
     * Lower-cased event kind, preferring {@code type} over {@code status}.
     */
    public String resolveKind() {
        String kind = type != null && !type.isBlank() ? type : status;
        return kind == null ? null : kind.trim().toLowerCase();
    }
}
