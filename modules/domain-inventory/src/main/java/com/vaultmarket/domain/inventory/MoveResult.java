package com.vaultmarket.domain.inventory;

/**
 * Units actually moved by one {@link InventoryMover} call. A short count is not an error; callers
 * decide whether {@code moved < requested} is acceptable.
 */
public record MoveResult(String item, int requested, int moved, String note) {
  public MoveResult {
    if (moved < 0) {
      throw new IllegalArgumentException("moved must be >= 0");
    }
  }

  public static MoveResult nothing(String item, int requested, String note) {
    return new MoveResult(item, requested, 0, note);
  }

  public boolean isComplete() {
    return requested > 0 && moved == requested;
  }

  public boolean isShort() {
    return moved < requested;
  }

  public boolean movedAnything() {
    return moved > 0;
  }
}
