package com.vaultmarket.domain.inventory.simulated;

import com.vaultmarket.domain.inventory.InventoryContainer;
import com.vaultmarket.domain.inventory.ItemStack;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class SimulatedContainer implements InventoryContainer {
  private final String name;
  private final ItemStack[] slots;
  private final int maxStackSize;
  private final SimulatedContainerNetwork network;

  SimulatedContainer(
      String name, int slotCount, int maxStackSize, SimulatedContainerNetwork network) {
    if (slotCount <= 0) {
      throw new IllegalArgumentException("slotCount must be > 0");
    }
    this.name = name;
    this.slots = new ItemStack[slotCount];
    this.maxStackSize = maxStackSize;
    this.network = network;
  }

  @Override
  public String name() {
    return name;
  }

  /** Slots are numbered from 1. */
  @Override
  public Map<Integer, ItemStack> list() {
    synchronized (network.lock()) {
      Map<Integer, ItemStack> contents = new TreeMap<>();
      for (int i = 0; i < slots.length; i++) {
        if (slots[i] != null) {
          contents.put(i + 1, slots[i]);
        }
      }
      return contents;
    }
  }

  @Override
  public int moveUnits(String destination, int slot, int count) {
    synchronized (network.lock()) {
      Optional<SimulatedContainer> target = network.container(destination);
      if (target.isEmpty() || target.get() == this || count <= 0) {
        return 0;
      }
      int index = slot - 1;
      if (index < 0 || index >= slots.length || slots[index] == null) {
        return 0;
      }
      ItemStack stack = slots[index];
      int accepted = target.get().insertLocked(stack.item(), Math.min(count, stack.count()));
      removeFromSlot(index, accepted);
      return accepted;
    }
  }

  /** Places up to {@code count} units into free space; returns how many fit. */
  public int insert(String item, int count) {
    synchronized (network.lock()) {
      return insertLocked(item, count);
    }
  }

  /** Removes up to {@code count} units of an item, e.g. to model someone emptying a chest. */
  public int extract(String item, int count) {
    synchronized (network.lock()) {
      int removed = 0;
      for (int i = 0; i < slots.length && removed < count; i++) {
        if (slots[i] != null && slots[i].item().equals(item)) {
          int take = Math.min(count - removed, slots[i].count());
          removeFromSlot(i, take);
          removed += take;
        }
      }
      return removed;
    }
  }

  public int countOf(String item) {
    synchronized (network.lock()) {
      int total = 0;
      for (ItemStack stack : slots) {
        if (stack != null && stack.item().equals(item)) {
          total += stack.count();
        }
      }
      return total;
    }
  }

  public int slotCount() {
    return slots.length;
  }

  private int insertLocked(String item, int count) {
    if (item == null || item.isBlank() || count <= 0) {
      return 0;
    }
    int remaining = count;
    for (int i = 0; i < slots.length && remaining > 0; i++) {
      ItemStack stack = slots[i];
      if (stack != null && stack.item().equals(item) && stack.count() < maxStackSize) {
        int add = Math.min(remaining, maxStackSize - stack.count());
        slots[i] = new ItemStack(item, stack.count() + add);
        remaining -= add;
      }
    }
    for (int i = 0; i < slots.length && remaining > 0; i++) {
      if (slots[i] == null) {
        int add = Math.min(remaining, maxStackSize);
        slots[i] = new ItemStack(item, add);
        remaining -= add;
      }
    }
    return count - remaining;
  }

  private void removeFromSlot(int index, int units) {
    if (units <= 0) {
      return;
    }
    ItemStack stack = slots[index];
    int left = stack.count() - units;
    slots[index] = left > 0 ? new ItemStack(stack.item(), left) : null;
  }
}
