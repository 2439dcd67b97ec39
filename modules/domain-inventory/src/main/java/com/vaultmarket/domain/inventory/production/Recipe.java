package com.vaultmarket.domain.inventory.production;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named batch of items pulled from the vault and pushed to one of several output containers.
 * Outputs are used in turn, one per run. Item order is kept as given.
 */
public record Recipe(
    String name, RecipeMode mode, Map<String, Integer> items, List<String> outputs) {

  /** Units split across the items of a {@link RecipeMode#PERCENT} recipe on each run. */
  public static final int PERCENT_BATCH = 64;

  public Recipe {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    Objects.requireNonNull(mode, "mode must not be null");
    Objects.requireNonNull(items, "items must not be null");
    Map<String, Integer> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : items.entrySet()) {
      String item = entry.getKey();
      Integer amount = entry.getValue();
      if (item == null || item.isBlank()) {
        throw new IllegalArgumentException("item must not be blank");
      }
      if (amount == null || amount < 0) {
        throw new IllegalArgumentException("amount for " + item + " must be >= 0");
      }
      copy.put(item, amount);
    }
    name = name.trim();
    items = Collections.unmodifiableMap(copy);
    outputs = outputs == null ? List.of() : List.copyOf(outputs);
  }

  public Recipe withOutputs(List<String> newOutputs) {
    return new Recipe(name, mode, items, newOutputs);
  }

  /**
   * Units of each item one run should push. Count recipes push their amounts as given. Percent
   * recipes round each share down and hand whatever rounding lost to the heaviest item (the first
   * one listed on a tie). Items that come out at zero are left out.
   */
  public Map<String, Integer> batch() {
    Map<String, Integer> plan = new LinkedHashMap<>();
    if (mode == RecipeMode.COUNT) {
      items.forEach(
          (item, amount) -> {
            if (amount > 0) {
              plan.put(item, amount);
            }
          });
      return plan;
    }

    long total = 0;
    for (int weight : items.values()) {
      total += weight;
    }
    if (total <= 0) {
      return plan;
    }
    int assigned = 0;
    String heaviest = null;
    int heaviestWeight = -1;
    for (Map.Entry<String, Integer> entry : items.entrySet()) {
      int share = (int) ((long) entry.getValue() * PERCENT_BATCH / total);
      if (share > 0) {
        plan.put(entry.getKey(), share);
        assigned += share;
      }
      if (entry.getValue() > heaviestWeight) {
        heaviestWeight = entry.getValue();
        heaviest = entry.getKey();
      }
    }
    int remainder = PERCENT_BATCH - assigned;
    if (remainder > 0 && heaviest != null) {
      plan.merge(heaviest, remainder, Integer::sum);
    }
    return plan;
  }

  public boolean hasWeight() {
    return items.values().stream().anyMatch(amount -> amount > 0);
  }
}
