package com.mercado.fulfillmentservice.controller;

import com.mercado.fulfillmentservice.config.FulfillmentProperties;
import com.mercado.fulfillmentservice.dto.WebhookRetryResult;
import com.mercado.fulfillmentservice.dto.WebhookRetryStats;
import com.mercado.fulfillmentservice.service.WebhookService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/admin/webhooks")
@RequiredArgsConstructor
public class WebhookAdminController {

    private final WebhookService webhookService;
    private final FulfillmentProperties properties;

    @GetMapping("/stats")
    public ResponseEntity<WebhookRetryStats> getStats() {
        return ResponseEntity.ok(webhookService.getRetryStats());
    }

    @PostMapping("/retry")
    public ResponseEntity<WebhookRetryResult> retry(@RequestParam(required = false) Integer batchSize) {
        int size = batchSize != null && batchSize > 0 ? batchSize : properties.getWebhook().getRetryBatchSize();
        return ResponseEntity.ok(webhookService.retryFailedWebhooks(size));
    }
}
