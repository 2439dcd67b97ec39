package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.domain.pricing.ItemPriceRecord;

public record ItemResponse(String item, long basePrice) {
  public static ItemResponse from(ItemPriceRecord record) {
    return new ItemResponse(record.item(), record.basePrice());
  }
}
