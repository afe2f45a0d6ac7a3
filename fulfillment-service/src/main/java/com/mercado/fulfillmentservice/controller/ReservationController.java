package com.mercado.fulfillmentservice.controller;

import com.mercado.common.exception.AccessDeniedException;
import com.mercado.fulfillmentservice.dto.ExtendReservationRequest;
import com.mercado.fulfillmentservice.dto.ReservationRequest;
import com.mercado.fulfillmentservice.dto.ReservationResponse;
import com.mercado.fulfillmentservice.exception.ReservationNotActiveException;
import com.mercado.fulfillmentservice.mapper.ReservationMapper;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.service.CheckoutService;
import com.mercado.fulfillmentservice.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CheckoutService checkoutService;
    private final ReservationService reservationService;
    private final ReservationMapper reservationMapper;

    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(
            @Valid @RequestBody ReservationRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        ReservationResponse response = checkoutService.reserve(request, jwt.getSubject());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(
            @PathVariable UUID reservationId,
            @AuthenticationPrincipal Jwt jwt) {
        Reservation reservation = ownedReservation(reservationId, jwt);
        return ResponseEntity.ok(reservationMapper.toReservationResponse(reservation));
    }

    @DeleteMapping("/{reservationId}")
    public ResponseEntity<Void> releaseReservation(
            @PathVariable UUID reservationId,
            @AuthenticationPrincipal Jwt jwt) {
        ownedReservation(reservationId, jwt);
        if (!reservationService.releaseReservation(reservationId)) {
            throw new ReservationNotActiveException(reservationId);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{reservationId}/extend")
    public ResponseEntity<ReservationResponse> extendReservation(
            @PathVariable UUID reservationId,
            @Valid @RequestBody ExtendReservationRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        ownedReservation(reservationId, jwt);
        Reservation extended = reservationService.extendReservation(
                reservationId, Duration.ofMinutes(request.getMinutes()));
        return ResponseEntity.ok(reservationMapper.toReservationResponse(extended));
    }

    private Reservation ownedReservation(UUID reservationId, Jwt jwt) {
        Reservation reservation = reservationService.getReservation(reservationId);
        if (!reservation.getRequesterId().equals(jwt.getSubject())) {
            throw new AccessDeniedException("You do not have access to reservation " + reservationId);
        }
        return reservation;
    }
}
