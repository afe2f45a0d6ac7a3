package com.mercado.fulfillmentservice.service;

import com.mercado.common.exception.InsufficientStockException;
import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.config.FulfillmentProperties;
import com.mercado.fulfillmentservice.event.ReservationChangedEvent;
import com.mercado.fulfillmentservice.exception.ConsistencyViolationException;
import com.mercado.fulfillmentservice.exception.ReservationNotActiveException;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.model.ReservationStatus;
import com.mercado.fulfillmentservice.repository.ReservationRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationServiceImpl implements ReservationService {

    private final ReservationRepository reservationRepository;
    private final StockLedgerService stockLedgerService;
    private final ApplicationEventPublisher eventPublisher;
    private final EntityManager entityManager;
    private final FulfillmentProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public Reservation createReservation(UUID productId, UUID variantId, int quantity, String requesterId) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, got " + quantity);
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("Requester id is required");
        }

        // Row lock on the product (or variant): the availability check and the insert
        // below are one step as far as other reservers of this item are concerned.
        StockLevel level = stockLedgerService.lockStock(productId, variantId);

        if (level.getAvailable() < quantity) {
            log.warn("Insufficient stock: productId={}, variantId={}, requested={}, available={}",
                    productId, variantId, quantity, level.getAvailable());
            throw new InsufficientStockException(
                    "Insufficient stock for product " + productId + ". Requested: " + quantity
                            + ", Available: " + level.getAvailable(),
                    level.getAvailable());
        }

        Instant now = clock.instant();
        Reservation reservation = Reservation.builder()
                .productId(productId)
                .variantId(variantId)
                .quantity(quantity)
                .requesterId(requesterId)
                .status(ReservationStatus.ACTIVE)
                .createdAt(now)
                .expiresAt(now.plus(properties.getReservation().getTtl()))
                .build();

        Reservation saved = reservationRepository.save(reservation);
        log.info("Reservation created: id={}, productId={}, variantId={}, quantity={}, expiresAt={}",
                saved.getId(), productId, variantId, quantity, saved.getExpiresAt());
        return saved;
    }

    @Override
    @Transactional
    public boolean commitReservation(UUID reservationId, UUID orderId) {
        Reservation reservation = findReservation(reservationId);

        if (reservation.getOrderId() != null && !reservation.getOrderId().equals(orderId)) {
            log.error("Reservation linked to another order: reservationId={}, linkedOrderId={}, requestedOrderId={}",
                    reservationId, reservation.getOrderId(), orderId);
            throw new ConsistencyViolationException("Reservation " + reservationId + " belongs to order "
                    + reservation.getOrderId() + ", not " + orderId);
        }

        // Same lock order as createReservation. Without it a concurrent reserver could
        // read the old physical stock and the new (smaller) active sum.
        stockLedgerService.lockStock(reservation.getProductId(), reservation.getVariantId());

        Instant now = clock.instant();
        int updated = reservationRepository.markCommitted(reservationId, orderId, now);
        if (updated == 0) {
            log.warn("Commit skipped, reservation not active: reservationId={}, orderId={}", reservationId, orderId);
            return false;
        }

        stockLedgerService.deductPhysicalStock(
                reservation.getProductId(), reservation.getVariantId(), reservation.getQuantity());

        entityManager.refresh(reservation);
        eventPublisher.publishEvent(new ReservationChangedEvent(this, reservation, "reservation.committed", now));

        log.info("Reservation committed: id={}, orderId={}, productId={}, quantity={}",
                reservationId, orderId, reservation.getProductId(), reservation.getQuantity());
        return true;
    }

    @Override
    @Transactional
    public boolean releaseReservation(UUID reservationId) {
        Reservation reservation = findReservation(reservationId);

        Instant now = clock.instant();
        int updated = reservationRepository.markReleased(reservationId, now);
        if (updated == 0) {
            log.debug("Release skipped, reservation not active: reservationId={}, status={}",
                    reservationId, reservation.getStatus());
            return false;
        }

        entityManager.refresh(reservation);
        eventPublisher.publishEvent(new ReservationChangedEvent(this, reservation, "reservation.released", now));

        log.info("Reservation released: id={}, productId={}, quantity={}",
                reservationId, reservation.getProductId(), reservation.getQuantity());
        return true;
    }

    @Override
    @Transactional
    public int expireStaleReservations(Instant now) {
        int expired = reservationRepository.expireStale(now);
        if (expired > 0) {
            log.info("Expired {} stale reservations (cutoff={})", expired, now);
        }
        return expired;
    }

    @Override
    @Transactional
    public Reservation extendReservation(UUID reservationId, Duration extra) {
        if (extra == null || extra.isNegative() || extra.isZero()) {
            throw new IllegalArgumentException("Extension must be positive");
        }
        Duration maxExtension = properties.getReservation().getMaxExtension();
        if (extra.compareTo(maxExtension) > 0) {
            throw new IllegalArgumentException("Extension may not exceed " + maxExtension);
        }

        Reservation reservation = findReservation(reservationId);
        Instant now = clock.instant();
        // past its deadline but not yet swept: already lost, the sweep will collect it
        if (!reservation.getExpiresAt().isAfter(now)) {
            log.warn("Extension refused, hold already expired: id={}, expiresAt={}",
                    reservationId, reservation.getExpiresAt());
            throw new ReservationNotActiveException(reservationId);
        }

        Instant newExpiry = reservation.getExpiresAt().plus(extra);
        Instant latestExpiry = reservation.getCreatedAt()
                .plus(properties.getReservation().getTtl())
                .plus(maxExtension);
        if (newExpiry.isAfter(latestExpiry)) {
            log.warn("Extension refused, lifetime cap reached: id={}, requested={}, latest={}",
                    reservationId, newExpiry, latestExpiry);
            throw new IllegalArgumentException("Reservation " + reservationId
                    + " cannot be held past " + latestExpiry);
        }

        int updated = reservationRepository.extend(reservationId, newExpiry);
        if (updated == 0) {
            throw new ReservationNotActiveException(reservationId);
        }

        entityManager.refresh(reservation);
        log.info("Reservation extended: id={}, expiresAt={}", reservationId, newExpiry);
        return reservation;
    }

    @Override
    @Transactional
    public boolean restoreCommittedStock(UUID reservationId) {
        Reservation reservation = findReservation(reservationId);
        if (reservation.getStatus() != ReservationStatus.COMMITTED) {
            return false;
        }

        stockLedgerService.addPhysicalStock(
                reservation.getProductId(), reservation.getVariantId(), reservation.getQuantity());
        eventPublisher.publishEvent(
                new ReservationChangedEvent(this, reservation, "reservation.stock_restored", clock.instant()));

        log.info("Committed stock restored: reservationId={}, productId={}, quantity={}",
                reservationId, reservation.getProductId(), reservation.getQuantity());
        return true;
    }

    @Override
    @Transactional
    public void restock(UUID productId, UUID variantId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Restock quantity must be positive, got " + quantity);
        }
        stockLedgerService.lockStock(productId, variantId);
        stockLedgerService.addPhysicalStock(productId, variantId, quantity);
        log.info("Restocked: productId={}, variantId={}, quantity={}", productId, variantId, quantity);
    }

    @Override
    @Transactional(readOnly = true)
    public Reservation getReservation(UUID reservationId) {
        return findReservation(reservationId);
    }

    private Reservation findReservation(UUID reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation not found with id: " + reservationId));
    }
}
