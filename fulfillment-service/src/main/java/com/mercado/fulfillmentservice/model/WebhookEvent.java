package com.mercado.fulfillmentservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One delivery of a payment provider notification.
 *
 * (provider, external_event_id) is unique: a redelivery loses the insert race and is
 * reported as a duplicate. Rejected deliveries (bad signature) are kept for audit
 * with a null external id so they never shadow the genuine event.
 */
@Entity
@Table(name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_webhook_provider_event",
                columnNames = {"provider", "external_event_id"}),
        indexes = @Index(name = "idx_webhook_retry_scan", columnList = "status, archived, next_retry_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String provider;

    @Column(name = "external_event_id")
    private String externalEventId;

    @Column(name = "order_id")
    private UUID orderId;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    // as sent by the provider
    private String signature;

    // HMAC we computed over the raw body
    @Column(name = "signature_hash")
    private String signatureHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WebhookEventStatus status;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    // set when an attempt starts; PENDING long past this means the attempt was lost
    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean archived = false;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
