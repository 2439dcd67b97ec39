package com.vaultmarket.ledgerserver.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record ContainerItemsRequest(
    @NotBlank(message = "item is required") String item,
    @Positive(message = "count must be greater than 0") int count) {}
