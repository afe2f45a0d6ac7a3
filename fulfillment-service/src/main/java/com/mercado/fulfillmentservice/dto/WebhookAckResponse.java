package com.mercado.fulfillmentservice.dto;

import com.mercado.fulfillmentservice.service.WebhookReceipt;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class WebhookAckResponse {
    private WebhookReceipt result;
    private String eventId;
}
