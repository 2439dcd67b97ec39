package com.vaultmarket.domain.inventory;

import java.util.Optional;

public interface ContainerNetwork {
  Optional<InventoryContainer> find(String name);
}
