package com.mercado.fulfillmentservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookRetryResult {
    private int processed;
    private int succeeded;
    private int failed;
}
