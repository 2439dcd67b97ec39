package com.vaultmarket.ledgerserver.bank;

import java.util.Map;

public record DepositResult(Map<String, Integer> moved, long credited, long balance) {
  public DepositResult {
    moved = Map.copyOf(moved);
  }

  public int totalMoved() {
    return moved.values().stream().mapToInt(Integer::intValue).sum();
  }
}
