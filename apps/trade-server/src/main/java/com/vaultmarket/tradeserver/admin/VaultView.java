package com.vaultmarket.tradeserver.admin;

import java.util.List;

public record VaultView(String vaultName, boolean attached, List<Line> lines) {
  public VaultView {
    lines = List.copyOf(lines);
  }

  /** {@code listed} above {@code count} means listings claim stock the vault no longer holds. */
  public record Line(String item, int count, int listed) {}
}
