package com.vaultmarket.domain.inventory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slot-by-slot, best-effort transfer of one item between two containers. Never reports more than
 * was requested and never touches slots holding another item. There is no rollback: undoing a
 * move is another, equally partial, move in the opposite direction.
 */
public class InventoryMover {
  private static final Logger log = LoggerFactory.getLogger(InventoryMover.class);

  private final ContainerNetwork network;

  public InventoryMover(ContainerNetwork network) {
    this.network = Objects.requireNonNull(network, "network must not be null");
  }

  public MoveResult move(String sourceName, String destinationName, String item, int requested) {
    if (requested <= 0) {
      return MoveResult.nothing(item, requested, null);
    }
    Optional<InventoryContainer> source = network.find(sourceName);
    if (source.isEmpty()) {
      return MoveResult.nothing(item, requested, "Container not found: " + sourceName);
    }
    Optional<InventoryContainer> destination = network.find(destinationName);
    if (destination.isEmpty()) {
      return MoveResult.nothing(item, requested, "Container not found: " + destinationName);
    }
    return move(source.get(), destination.get(), item, requested);
  }

  public MoveResult move(
      InventoryContainer source, InventoryContainer destination, String item, int requested) {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(destination, "destination must not be null");
    if (requested <= 0 || item == null) {
      return MoveResult.nothing(item, requested, null);
    }

    int moved = 0;
    Map<Integer, ItemStack> contents = new TreeMap<>(source.list());
    for (Map.Entry<Integer, ItemStack> slot : contents.entrySet()) {
      if (moved >= requested) {
        break;
      }
      ItemStack stack = slot.getValue();
      if (stack == null || !item.equals(stack.item())) {
        continue;
      }
      int wanted = Math.min(requested - moved, stack.count());
      int reported = source.moveUnits(destination.name(), slot.getKey(), wanted);
      if (reported > wanted) {
        log.warn(
            "Container over-reported move source={} slot={} wanted={} reported={}",
            source.name(),
            slot.getKey(),
            wanted,
            reported);
        reported = wanted;
      }
      moved += Math.max(0, reported);
    }

    String note = null;
    if (moved == 0) {
      note = "No " + item + " moved from " + source.name();
    } else if (moved < requested) {
      note = "Only moved " + moved + " of " + requested + " " + item;
    }
    log.debug(
        "Moved item={} requested={} moved={} source={} destination={}",
        item,
        requested,
        moved,
        source.name(),
        destination.name());
    return new MoveResult(item, requested, moved, note);
  }
}
