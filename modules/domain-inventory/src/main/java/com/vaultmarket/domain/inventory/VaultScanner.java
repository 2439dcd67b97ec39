package com.vaultmarket.domain.inventory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public final class VaultScanner {
  private VaultScanner() {}

  public static VaultStockSnapshot scan(InventoryContainer container) {
    Map<String, Integer> counts = new HashMap<>();
    for (ItemStack stack : container.list().values()) {
      if (stack != null) {
        counts.merge(stack.item(), stack.count(), Integer::sum);
      }
    }
    return new VaultStockSnapshot(counts);
  }

  public static Optional<VaultStockSnapshot> scan(ContainerNetwork network, String name) {
    return network.find(name).map(VaultScanner::scan);
  }
}
