package com.vaultmarket.domain.pricing;

import java.util.Objects;

/**
 * Global knobs of the elastic price curve. {@code maxStock} normalizes the stock ratio,
 * {@code minPrice} is the floor and {@code elasticity} controls how fast the price decays as the
 * vault fills up.
 */
public record PriceConfiguration(
    long maxStock, long minPrice, double elasticity, String currencySymbol) {
  public static final long DEFAULT_MAX_STOCK = 1000L;
  public static final long DEFAULT_MIN_PRICE = 1L;
  public static final double DEFAULT_ELASTICITY = 1.2d;
  public static final String DEFAULT_CURRENCY_SYMBOL = "$";

  public PriceConfiguration {
    Objects.requireNonNull(currencySymbol, "currencySymbol must not be null");
  }

  public static PriceConfiguration defaults() {
    return new PriceConfiguration(
        DEFAULT_MAX_STOCK, DEFAULT_MIN_PRICE, DEFAULT_ELASTICITY, DEFAULT_CURRENCY_SYMBOL);
  }

  /** Builds a configuration for an admin update, rejecting values the curve cannot use. */
  public static PriceConfiguration validated(
      long maxStock, long minPrice, double elasticity, String currencySymbol) {
    if (maxStock <= 0) {
      throw new PricingDomainException("maxStock must be > 0");
    }
    if (minPrice < 0) {
      throw new PricingDomainException("minPrice must be >= 0");
    }
    if (Double.isNaN(elasticity) || Double.isInfinite(elasticity) || elasticity < 0) {
      throw new PricingDomainException("elasticity must be a finite number >= 0");
    }
    if (currencySymbol == null || currencySymbol.isBlank()) {
      throw new PricingDomainException("currencySymbol must not be blank");
    }
    return new PriceConfiguration(maxStock, minPrice, elasticity, currencySymbol.trim());
  }

  public PriceConfiguration withMaxStock(long value) {
    return validated(value, minPrice, elasticity, currencySymbol);
  }

  public PriceConfiguration withMinPrice(long value) {
    return validated(maxStock, value, elasticity, currencySymbol);
  }

  public PriceConfiguration withElasticity(double value) {
    return validated(maxStock, minPrice, value, currencySymbol);
  }

  public PriceConfiguration withCurrencySymbol(String value) {
    return validated(maxStock, minPrice, elasticity, value);
  }

  public String format(long amount) {
    return currencySymbol + amount;
  }
}
