package com.mercado.fulfillmentservice.controller;

import com.mercado.fulfillmentservice.dto.WebhookAckResponse;
import com.mercado.fulfillmentservice.service.WebhookReceipt;
import com.mercado.fulfillmentservice.service.WebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Receives provider notifications. Authenticated by HMAC signature only.
 *
 * Duplicates and malformed payloads get 200 as well, otherwise providers keep
 * redelivering a body that will never apply. Malformed ones are archived for operators.
 */
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String EVENT_ID_HEADER = "X-Webhook-Event-Id";

    private final WebhookService webhookService;

    @PostMapping("/{provider}")
    public ResponseEntity<WebhookAckResponse> receive(
            @PathVariable String provider,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = EVENT_ID_HEADER, required = false) String eventId,
            @RequestBody String rawBody) {
        WebhookReceipt receipt = webhookService.receiveEvent(provider, eventId, rawBody, signature);

        HttpStatus status = receipt == WebhookReceipt.INVALID_SIGNATURE ? HttpStatus.UNAUTHORIZED : HttpStatus.OK;
        return ResponseEntity.status(status).body(new WebhookAckResponse(receipt, eventId));
    }
}
