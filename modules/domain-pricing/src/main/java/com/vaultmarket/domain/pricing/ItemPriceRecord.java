package com.vaultmarket.domain.pricing;

public record ItemPriceRecord(String item, long basePrice) {
  public ItemPriceRecord {
    if (item == null || item.isBlank()) {
      throw new PricingDomainException("item must not be blank");
    }
    if (basePrice <= 0) {
      throw new PricingDomainException("basePrice must be > 0");
    }
  }
}
