package com.vaultmarket.domain.inventory;

public record ItemStack(String item, int count) {
  public ItemStack {
    if (item == null || item.isBlank()) {
      throw new IllegalArgumentException("item must not be blank");
    }
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0");
    }
  }
}
