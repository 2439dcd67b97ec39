package com.vaultmarket.domain.inventory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** Item counts scanned from a container at one moment. Never cached across operations. */
public record VaultStockSnapshot(Map<String, Integer> counts) {
  public VaultStockSnapshot {
    counts = Map.copyOf(Objects.requireNonNull(counts, "counts must not be null"));
  }

  public static VaultStockSnapshot empty() {
    return new VaultStockSnapshot(Map.of());
  }

  public int count(String item) {
    return counts.getOrDefault(item, 0);
  }

  public Set<String> items() {
    return new TreeMap<>(counts).keySet();
  }
}
