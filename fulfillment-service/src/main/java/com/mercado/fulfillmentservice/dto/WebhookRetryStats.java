package com.mercado.fulfillmentservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRetryStats {
    private long pendingRetries;   // ERROR, below the retry cap, not archived
    private long failedWebhooks;   // ERROR, not archived
    private long archivedWebhooks;
}
