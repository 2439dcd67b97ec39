package com.vaultmarket.domain.pricing;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Elastic unit price: falls as physical stock rises, never below the configured floor and never
 * above the base price. Prices are whole currency units rounded down.
 */
public class PricingEngine {
  private final ItemCatalog catalog;
  private final Supplier<PriceConfiguration> configuration;

  public PricingEngine(ItemCatalog catalog, Supplier<PriceConfiguration> configuration) {
    this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
  }

  /** Unit price at the given stock, or empty when the item is not for sale. */
  public OptionalLong price(String item, long stock) {
    Optional<ItemPriceRecord> record = catalog.find(item);
    if (record.isEmpty()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(unitPrice(record.get().basePrice(), stock, configuration.get()));
  }

  public PriceConfiguration configuration() {
    return configuration.get();
  }

  public static long unitPrice(long basePrice, long stock, PriceConfiguration config) {
    Objects.requireNonNull(config, "config must not be null");
    if (basePrice <= 0) {
      throw new PricingDomainException("basePrice must be > 0");
    }
    long maxStock =
        config.maxStock() > 0 ? config.maxStock() : PriceConfiguration.DEFAULT_MAX_STOCK;
    double elasticity = Math.max(0d, config.elasticity());
    double ratio = (double) Math.max(0L, stock) / maxStock;
    double raw = basePrice / (1d + elasticity * ratio);
    return (long) Math.floor(Math.max((double) config.minPrice(), raw));
  }
}
