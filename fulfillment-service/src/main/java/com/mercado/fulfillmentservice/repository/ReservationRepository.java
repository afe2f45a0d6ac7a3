package com.mercado.fulfillmentservice.repository;

import com.mercado.fulfillmentservice.model.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Every status change here is a conditional update on {@code status = ACTIVE}. Callers
 * look at the returned row count: zero means another transaction got there first.
 */
@Repository
public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM Reservation r " +
           "WHERE r.productId = :productId AND r.variantId IS NULL " +
           "AND r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE")
    long sumActiveQuantityForProduct(@Param("productId") UUID productId);

    @Query("SELECT COALESCE(SUM(r.quantity), 0) FROM Reservation r " +
           "WHERE r.productId = :productId AND r.variantId = :variantId " +
           "AND r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE")
    long sumActiveQuantityForVariant(@Param("productId") UUID productId, @Param("variantId") UUID variantId);

    @Modifying
    @Query("UPDATE Reservation r SET r.status = com.mercado.fulfillmentservice.model.ReservationStatus.COMMITTED, " +
           "r.orderId = :orderId, r.resolvedAt = :now " +
           "WHERE r.id = :id AND r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE")
    int markCommitted(@Param("id") UUID id, @Param("orderId") UUID orderId, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE Reservation r SET r.status = com.mercado.fulfillmentservice.model.ReservationStatus.RELEASED, " +
           "r.resolvedAt = :now " +
           "WHERE r.id = :id AND r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE")
    int markReleased(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE Reservation r SET r.status = com.mercado.fulfillmentservice.model.ReservationStatus.EXPIRED, " +
           "r.resolvedAt = :now " +
           "WHERE r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE AND r.expiresAt <= :now")
    int expireStale(@Param("now") Instant now);

    @Modifying
    @Query("UPDATE Reservation r SET r.expiresAt = :expiresAt " +
           "WHERE r.id = :id AND r.status = com.mercado.fulfillmentservice.model.ReservationStatus.ACTIVE")
    int extend(@Param("id") UUID id, @Param("expiresAt") Instant expiresAt);

    List<Reservation> findByOrderId(UUID orderId);
}
