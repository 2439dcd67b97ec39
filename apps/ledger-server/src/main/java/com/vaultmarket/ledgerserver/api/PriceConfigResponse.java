package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.domain.pricing.PriceConfiguration;

public record PriceConfigResponse(
    long maxStock, long minPrice, double elasticity, String currencySymbol) {
  public static PriceConfigResponse from(PriceConfiguration config) {
    return new PriceConfigResponse(
        config.maxStock(), config.minPrice(), config.elasticity(), config.currencySymbol());
  }
}
