package com.mercado.fulfillmentservice.controller;

import com.mercado.fulfillmentservice.dto.OrderEventResponse;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.dto.StatusUpdateRequest;
import com.mercado.fulfillmentservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrdersForUser(userId(jwt)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrder(orderId, userId(jwt)));
    }

    @GetMapping("/{orderId}/events")
    public ResponseEntity<List<OrderEventResponse>> getOrderHistory(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrderHistory(orderId, userId(jwt)));
    }

    // operator endpoint, the actor is recorded in the audit trail
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody StatusUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.updateStatus(
                orderId, request.getStatus(), jwt.getSubject(), request.getNote());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.cancelOrder(orderId, userId(jwt)));
    }

    private UUID userId(Jwt jwt) {
        return UUID.fromString(jwt.getSubject());
    }
}
