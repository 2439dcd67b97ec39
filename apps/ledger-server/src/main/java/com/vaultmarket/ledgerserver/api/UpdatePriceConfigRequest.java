package com.vaultmarket.ledgerserver.api;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/** Partial update; omitted fields keep their current value. */
public record UpdatePriceConfigRequest(
    @Positive(message = "maxStock must be greater than 0") Long maxStock,
    @PositiveOrZero(message = "minPrice must not be negative") Long minPrice,
    @PositiveOrZero(message = "elasticity must not be negative") Double elasticity,
    String currencySymbol) {}
