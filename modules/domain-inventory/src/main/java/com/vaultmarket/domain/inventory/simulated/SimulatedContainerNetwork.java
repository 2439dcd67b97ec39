package com.vaultmarket.domain.inventory.simulated;

import com.vaultmarket.domain.inventory.ContainerNetwork;
import com.vaultmarket.domain.inventory.InventoryContainer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a network of attached container devices. Moves between two simulated
 * containers are atomic per slot; all containers of one network share a single lock.
 */
public class SimulatedContainerNetwork implements ContainerNetwork {
  public static final int DEFAULT_MAX_STACK_SIZE = 64;

  private final Map<String, SimulatedContainer> containers = new ConcurrentHashMap<>();
  private final Object lock = new Object();
  private final int maxStackSize;

  public SimulatedContainerNetwork() {
    this(DEFAULT_MAX_STACK_SIZE);
  }

  public SimulatedContainerNetwork(int maxStackSize) {
    if (maxStackSize <= 0) {
      throw new IllegalArgumentException("maxStackSize must be > 0");
    }
    this.maxStackSize = maxStackSize;
  }

  public SimulatedContainer attach(String name, int slots) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    SimulatedContainer container = new SimulatedContainer(name, slots, maxStackSize, this);
    SimulatedContainer previous = containers.putIfAbsent(name, container);
    if (previous != null) {
      throw new IllegalArgumentException("Container already attached: " + name);
    }
    return container;
  }

  public boolean detach(String name) {
    return containers.remove(name) != null;
  }

  @Override
  public Optional<InventoryContainer> find(String name) {
    return container(name).map(InventoryContainer.class::cast);
  }

  public Optional<SimulatedContainer> container(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(containers.get(name));
  }

  public List<String> names() {
    List<String> names = new ArrayList<>(containers.keySet());
    names.sort(String::compareTo);
    return names;
  }

  Object lock() {
    return lock;
  }
}
