package com.mercado.fulfillmentservice.job;

import com.mercado.fulfillmentservice.config.FulfillmentProperties;
import com.mercado.fulfillmentservice.service.WebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookRetryJob {

    private final WebhookService webhookService;
    private final FulfillmentProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${fulfillment.webhook.retry-interval:PT60S}")
    public void retryFailedWebhooks() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Webhook retry sweep already running, skipping");
            return;
        }
        try {
            webhookService.retryFailedWebhooks(properties.getWebhook().getRetryBatchSize());
        } catch (Exception e) {
            log.error("Webhook retry sweep failed", e);
        } finally {
            running.set(false);
        }
    }
}
