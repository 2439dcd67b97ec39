package com.vaultmarket.domain.inventory;

import java.util.Map;

/**
 * A physical container device. The device is trusted but fallible: a move may deliver fewer units
 * than asked for, and the returned count is the only record of what actually happened.
 */
public interface InventoryContainer {
  String name();

  /** Occupied slots keyed by slot number. */
  Map<Integer, ItemStack> list();

  /** Pushes up to {@code count} units out of {@code slot} into the named container. */
  int moveUnits(String destination, int slot, int count);
}
