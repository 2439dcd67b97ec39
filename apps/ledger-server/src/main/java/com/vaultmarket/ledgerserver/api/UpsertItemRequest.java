package com.vaultmarket.ledgerserver.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record UpsertItemRequest(
    @NotBlank(message = "item is required") String item,
    @NotNull(message = "basePrice is required")
        @Positive(message = "basePrice must be greater than 0")
        Long basePrice) {}
