package com.vaultmarket.ledgerserver.bank;

/** {@code moved} may be lower than requested; {@code charged} covers only the moved units. */
public record WithdrawResult(int requested, int moved, long unitPrice, long charged, long balance) {
  public boolean isShort() {
    return moved < requested;
  }
}
