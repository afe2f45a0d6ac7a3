package com.mercado.fulfillmentservice.repository;

import com.mercado.fulfillmentservice.model.WebhookEvent;
import com.mercado.fulfillmentservice.model.WebhookEventStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {

    boolean existsByProviderAndExternalEventId(String provider, String externalEventId);

    @Query("SELECT w FROM WebhookEvent w " +
           "WHERE w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.ERROR " +
           "AND w.archived = false AND w.retryCount < :maxRetries " +
           "AND (w.nextRetryAt IS NULL OR w.nextRetryAt <= :now) " +
           "ORDER BY w.createdAt ASC")
    List<WebhookEvent> findRetryCandidates(@Param("maxRetries") int maxRetries,
                                           @Param("now") Instant now,
                                           Pageable pageable);

    // ERROR -> PENDING; the sweep that gets 1 owns the retry
    @Modifying
    @Query("UPDATE WebhookEvent w SET w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.PENDING, " +
           "w.lastAttemptAt = :now " +
           "WHERE w.id = :id AND w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.ERROR " +
           "AND w.archived = false")
    int claimForRetry(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * PENDING rows whose attempt never recorded an outcome, because the process died
     * mid-attempt or the outcome write itself failed. They go back to ERROR, due at
     * once, and the lost attempt counts against the retry cap.
     */
    @Modifying
    @Query("UPDATE WebhookEvent w SET w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.ERROR, " +
           "w.retryCount = w.retryCount + 1, w.nextRetryAt = NULL, " +
           "w.errorMessage = 'Attempt interrupted before an outcome was recorded' " +
           "WHERE w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.PENDING " +
           "AND w.archived = false AND COALESCE(w.lastAttemptAt, w.createdAt) <= :cutoff")
    int recoverStalePending(@Param("cutoff") Instant cutoff);

    // ERROR rows that already used up their attempts but slipped past archiving
    @Modifying
    @Query("UPDATE WebhookEvent w SET w.archived = true " +
           "WHERE w.status = com.mercado.fulfillmentservice.model.WebhookEventStatus.ERROR " +
           "AND w.archived = false AND w.retryCount >= :maxRetries")
    int archiveExhausted(@Param("maxRetries") int maxRetries);

    long countByStatusAndArchivedFalseAndRetryCountLessThan(WebhookEventStatus status, int maxRetries);

    long countByStatusAndArchivedFalse(WebhookEventStatus status);

    long countByArchivedTrue();
}
