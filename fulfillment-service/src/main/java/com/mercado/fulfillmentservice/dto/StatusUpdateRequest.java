package com.mercado.fulfillmentservice.dto;

import com.mercado.fulfillmentservice.model.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class StatusUpdateRequest {
    @NotNull(message = "Status cannot be null")
    private OrderStatus status;

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    private String note;
}
