package com.mercado.fulfillmentservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class CheckoutRequest {
    @NotEmpty(message = "Checkout must contain at least one item")
    @Valid
    private List<CheckoutItemRequest> items;
}
