package com.mercado.fulfillmentservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.config.FulfillmentProperties;
import com.mercado.fulfillmentservice.dto.PaymentEventPayload;
import com.mercado.fulfillmentservice.dto.WebhookRetryResult;
import com.mercado.fulfillmentservice.dto.WebhookRetryStats;
import com.mercado.fulfillmentservice.model.WebhookEvent;
import com.mercado.fulfillmentservice.model.WebhookEventStatus;
import com.mercado.fulfillmentservice.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Webhook intake and retry.
 *
 * Nothing here runs in one long transaction. Storing the event, applying it to the
 * order and recording the outcome each commit on their own, so a failed order
 * transition never takes the record of the failure down with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookServiceImpl implements WebhookService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final WebhookEventRepository webhookEventRepository;
    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentEventHandler paymentEventHandler;
    private final FulfillmentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    @Lazy
    private WebhookServiceImpl self;

    @Override
    public WebhookReceipt receiveEvent(String provider, String externalEventId, String rawPayload, String signature) {
        String normalizedProvider = provider.toLowerCase(Locale.ROOT);
        String computed = signatureVerifier.sign(normalizedProvider, rawPayload);

        if (!signatureVerifier.matches(computed, signature)) {
            log.warn("Invalid webhook signature: provider={}, eventId={}", normalizedProvider, externalEventId);
            self.storeRejected(normalizedProvider, rawPayload, signature, computed);
            return WebhookReceipt.INVALID_SIGNATURE;
        }

        PaymentEventPayload payload;
        try {
            payload = objectMapper.readValue(rawPayload, PaymentEventPayload.class);
        } catch (JsonProcessingException e) {
            return rejectMalformed(normalizedProvider, externalEventId, rawPayload, signature, computed,
                    "Unreadable payload: " + e.getOriginalMessage());
        }

        String eventId = hasText(externalEventId) ? externalEventId : payload.resolveEventId();
        if (!hasText(eventId)) {
            return rejectMalformed(normalizedProvider, null, rawPayload, signature, computed,
                    "Payload carries no event id");
        }

        // fast path, the unique constraint below settles races
        if (webhookEventRepository.existsByProviderAndExternalEventId(normalizedProvider, eventId)) {
            log.info("Duplicate webhook ignored: provider={}, eventId={}", normalizedProvider, eventId);
            return WebhookReceipt.DUPLICATE_IGNORED;
        }

        UUID storedId;
        try {
            storedId = self.storePending(normalizedProvider, eventId, payload.getOrderId(),
                    rawPayload, signature, computed);
        } catch (DataIntegrityViolationException e) {
            log.info("Duplicate webhook ignored (caught by constraint): provider={}, eventId={}",
                    normalizedProvider, eventId);
            return WebhookReceipt.DUPLICATE_IGNORED;
        }

        log.info("Webhook stored: id={}, provider={}, eventId={}, orderId={}",
                storedId, normalizedProvider, eventId, payload.getOrderId());

        ProcessingResult result = process(storedId);
        log.debug("Webhook processed on receipt: id={}, result={}", storedId, result);
        return WebhookReceipt.ACCEPTED;
    }

    @Override
    public ProcessingResult process(UUID webhookEventId) {
        WebhookEvent event = webhookEventRepository.findById(webhookEventId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook event not found with id: " + webhookEventId));

        if (event.getStatus() != WebhookEventStatus.PENDING || event.isArchived()) {
            log.debug("Webhook not processable: id={}, status={}, archived={}",
                    webhookEventId, event.getStatus(), event.isArchived());
            return ProcessingResult.SKIPPED;
        }

        try {
            PaymentEventPayload payload = objectMapper.readValue(event.getPayload(), PaymentEventPayload.class);
            paymentEventHandler.handle(event.getProvider(), payload);
            self.markProcessed(webhookEventId, payload.getOrderId());
            return ProcessingResult.PROCESSED;
        } catch (Exception e) {
            log.error("Webhook processing failed: id={}, provider={}, eventId={}, reason={}",
                    webhookEventId, event.getProvider(), event.getExternalEventId(), e.getMessage(), e);
            return self.markFailed(webhookEventId, describe(e));
        }
    }

    @Override
    public WebhookRetryResult retryFailedWebhooks(int batchSize) {
        int maxRetries = properties.getWebhook().getMaxRetries();

        int recovered = self.recoverStalePending();
        if (recovered > 0) {
            log.warn("Recovered {} webhook events left PENDING by an interrupted attempt", recovered);
        }

        int archived = self.archiveExhausted(maxRetries);
        if (archived > 0) {
            log.warn("Archived {} webhook events that reached the retry cap", archived);
        }

        List<WebhookEvent> candidates = webhookEventRepository.findRetryCandidates(
                maxRetries, clock.instant(), PageRequest.of(0, batchSize));

        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        for (WebhookEvent candidate : candidates) {
            if (!self.claimForRetry(candidate.getId(), clock.instant())) {
                // another sweep took it
                continue;
            }
            processed++;
            if (process(candidate.getId()).isSuccess()) {
                succeeded++;
            } else {
                failed++;
            }
        }

        if (processed > 0) {
            log.info("Webhook retry sweep finished: processed={}, succeeded={}, failed={}",
                    processed, succeeded, failed);
        }
        return new WebhookRetryResult(processed, succeeded, failed);
    }

    @Override
    @Transactional(readOnly = true)
    public WebhookRetryStats getRetryStats() {
        int maxRetries = properties.getWebhook().getMaxRetries();
        return WebhookRetryStats.builder()
                .pendingRetries(webhookEventRepository.countByStatusAndArchivedFalseAndRetryCountLessThan(
                        WebhookEventStatus.ERROR, maxRetries))
                .failedWebhooks(webhookEventRepository.countByStatusAndArchivedFalse(WebhookEventStatus.ERROR))
                .archivedWebhooks(webhookEventRepository.countByArchivedTrue())
                .build();
    }

    /**
     * Inserts the PENDING row in its own transaction. A duplicate (provider, event id)
     * surfaces as {@link DataIntegrityViolationException} after this transaction has
     * rolled back cleanly.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID storePending(String provider, String eventId, UUID orderId,
                             String rawPayload, String signature, String signatureHash) {
        Instant now = clock.instant();
        WebhookEvent event = WebhookEvent.builder()
                .provider(provider)
                .externalEventId(eventId)
                .orderId(orderId)
                .payload(rawPayload)
                .signature(signature)
                .signatureHash(signatureHash)
                .status(WebhookEventStatus.PENDING)
                .createdAt(now)
                .lastAttemptAt(now)
                .build();
        return webhookEventRepository.saveAndFlush(event).getId();
    }

    /**
     * Audit record for a delivery that failed verification. No external id, so it can
     * never collide with the genuine event.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void storeRejected(String provider, String rawPayload, String signature, String signatureHash) {
        WebhookEvent event = WebhookEvent.builder()
                .provider(provider)
                .externalEventId(null)
                .payload(asJsonColumn(rawPayload))
                .signature(signature)
                .signatureHash(signatureHash)
                .status(WebhookEventStatus.ERROR)
                .archived(true)
                .errorMessage("Invalid signature")
                .createdAt(clock.instant())
                .build();
        webhookEventRepository.save(event);
    }

    /**
     * Audit record for a signed delivery that cannot be applied as sent. Keeps the
     * provider's event id when the header carried one, so a redelivery is a duplicate.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void storeMalformed(String provider, String externalEventId, String rawPayload,
                               String signature, String signatureHash, String reason) {
        WebhookEvent event = WebhookEvent.builder()
                .provider(provider)
                .externalEventId(externalEventId)
                .payload(asJsonColumn(rawPayload))
                .signature(signature)
                .signatureHash(signatureHash)
                .status(WebhookEventStatus.ERROR)
                .archived(true)
                .errorMessage(truncate(reason))
                .createdAt(clock.instant())
                .build();
        webhookEventRepository.saveAndFlush(event);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markProcessed(UUID webhookEventId, UUID orderId) {
        WebhookEvent event = findEvent(webhookEventId);
        event.setStatus(WebhookEventStatus.PROCESSED);
        event.setProcessedAt(clock.instant());
        event.setNextRetryAt(null);
        event.setErrorMessage(null);
        if (orderId != null) {
            event.setOrderId(orderId);
        }
        log.info("Webhook processed: id={}, orderId={}, attempts={}",
                webhookEventId, orderId, event.getRetryCount() + 1);
    }

    /**
     * Records a failed attempt: ERROR, one more retry used, next attempt after
     * {@code min(initialBackoff * 2^retryCount, maxBackoff)}, archived at the cap.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ProcessingResult markFailed(UUID webhookEventId, String errorMessage) {
        WebhookEvent event = findEvent(webhookEventId);
        int retryCount = event.getRetryCount() + 1;
        int maxRetries = properties.getWebhook().getMaxRetries();

        event.setStatus(WebhookEventStatus.ERROR);
        event.setRetryCount(retryCount);
        event.setErrorMessage(errorMessage);

        if (retryCount >= maxRetries) {
            event.setArchived(true);
            event.setNextRetryAt(null);
            log.error("Webhook archived after {} attempts: id={}, provider={}, eventId={}",
                    retryCount, webhookEventId, event.getProvider(), event.getExternalEventId());
            return ProcessingResult.ARCHIVED;
        }

        Instant nextRetryAt = clock.instant().plus(backoff(retryCount));
        event.setNextRetryAt(nextRetryAt);
        log.warn("Webhook retry scheduled: id={}, retryCount={}, nextRetryAt={}",
                webhookEventId, retryCount, nextRetryAt);
        return ProcessingResult.RETRY_SCHEDULED;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claimForRetry(UUID webhookEventId, Instant now) {
        return webhookEventRepository.claimForRetry(webhookEventId, now) == 1;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recoverStalePending() {
        Instant cutoff = clock.instant().minus(properties.getWebhook().getStalePendingAfter());
        return webhookEventRepository.recoverStalePending(cutoff);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int archiveExhausted(int maxRetries) {
        return webhookEventRepository.archiveExhausted(maxRetries);
    }

    Duration backoff(int retryCount) {
        Duration initial = properties.getWebhook().getInitialBackoff();
        Duration max = properties.getWebhook().getMaxBackoff();
        // 2^retryCount overflows long arithmetic long before it matters, cap the shift
        int shift = Math.min(retryCount, 30);
        Duration delay = initial.multipliedBy(1L << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private WebhookReceipt rejectMalformed(String provider, String externalEventId, String rawPayload,
                                           String signature, String signatureHash, String reason) {
        log.warn("Malformed webhook archived: provider={}, eventId={}, reason={}", provider, externalEventId, reason);
        try {
            self.storeMalformed(provider, externalEventId, rawPayload, signature, signatureHash, reason);
        } catch (DataIntegrityViolationException e) {
            log.info("Duplicate webhook ignored (caught by constraint): provider={}, eventId={}",
                    provider, externalEventId);
            return WebhookReceipt.DUPLICATE_IGNORED;
        }
        return WebhookReceipt.MALFORMED_PAYLOAD;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    // the payload column is jsonb; wrap bodies that are not JSON as a JSON string
    private String asJsonColumn(String rawPayload) {
        try {
            if (rawPayload != null && !objectMapper.readTree(rawPayload).isMissingNode()) {
                return rawPayload;
            }
        } catch (JsonProcessingException e) {
            log.debug("Rejected webhook body is not JSON, storing it as a string");
        }
        try {
            return objectMapper.writeValueAsString(rawPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode webhook body", e);
        }
    }

    private WebhookEvent findEvent(UUID webhookEventId) {
        return webhookEventRepository.findById(webhookEventId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook event not found with id: " + webhookEventId));
    }

    private static String describe(Exception e) {
        return truncate(e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private static String truncate(String message) {
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
