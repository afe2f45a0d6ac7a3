package com.mercado.fulfillmentservice.controller;

import com.mercado.fulfillmentservice.dto.RestockRequest;
import com.mercado.fulfillmentservice.dto.StockResponse;
import com.mercado.fulfillmentservice.mapper.ReservationMapper;
import com.mercado.fulfillmentservice.service.ReservationService;
import com.mercado.fulfillmentservice.service.StockLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/stock")
@RequiredArgsConstructor
public class StockController {

    private final StockLedgerService stockLedgerService;
    private final ReservationService reservationService;
    private final ReservationMapper reservationMapper;

    // public endpoint: product pages show availability to anonymous visitors
    @GetMapping("/{productId}")
    public ResponseEntity<StockResponse> getStock(
            @PathVariable UUID productId,
            @RequestParam(required = false) UUID variantId) {
        return ResponseEntity.ok(reservationMapper.toStockResponse(
                stockLedgerService.getStockLevel(productId, variantId)));
    }

    @PostMapping("/{productId}/restock")
    public ResponseEntity<StockResponse> restock(
            @PathVariable UUID productId,
            @Valid @RequestBody RestockRequest request) {
        reservationService.restock(productId, request.getVariantId(), request.getQuantity());
        return ResponseEntity.ok(reservationMapper.toStockResponse(
                stockLedgerService.getStockLevel(productId, request.getVariantId())));
    }
}
