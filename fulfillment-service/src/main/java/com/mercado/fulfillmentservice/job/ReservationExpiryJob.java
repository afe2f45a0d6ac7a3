package com.mercado.fulfillmentservice.job;

import com.mercado.fulfillmentservice.service.ReservationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reclaims abandoned holds. Safe to overlap with commits: both sides are
 * conditional updates on ACTIVE, exactly one wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReservationExpiryJob {

    private final ReservationService reservationService;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${fulfillment.reservation.expiry-sweep-interval:PT30S}")
    public void expireStaleReservations() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Reservation expiry sweep already running, skipping");
            return;
        }
        try {
            reservationService.expireStaleReservations(clock.instant());
        } catch (Exception e) {
            // next tick tries again
            log.error("Reservation expiry sweep failed", e);
        } finally {
            running.set(false);
        }
    }
}
