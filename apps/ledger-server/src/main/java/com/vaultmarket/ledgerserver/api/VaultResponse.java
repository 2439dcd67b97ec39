package com.vaultmarket.ledgerserver.api;

import java.util.List;

public record VaultResponse(String vaultName, List<VaultStockLine> stock) {
  public record VaultStockLine(String item, int count, long price, long basePrice) {}
}
