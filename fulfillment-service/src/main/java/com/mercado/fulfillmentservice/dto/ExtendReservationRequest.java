package com.mercado.fulfillmentservice.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ExtendReservationRequest {
    @NotNull(message = "Minutes cannot be null")
    @Min(value = 1, message = "Extension must be at least 1 minute")
    private Integer minutes;
}
