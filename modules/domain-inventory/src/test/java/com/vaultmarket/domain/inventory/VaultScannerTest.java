package com.vaultmarket.domain.inventory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import org.junit.jupiter.api.Test;

class VaultScannerTest {
  @Test
  void shouldSumCountsAcrossSlots() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork();
    SimulatedContainer vault = network.attach("vault", 27);
    vault.insert("widget", 130);
    vault.insert("gadget", 5);

    VaultStockSnapshot snapshot = VaultScanner.scan(vault);

    assertEquals(130, snapshot.count("widget"));
    assertEquals(5, snapshot.count("gadget"));
    assertEquals(0, snapshot.count("sprocket"));
    assertEquals("gadget", snapshot.items().iterator().next());
  }

  @Test
  void shouldReturnEmptyForUnknownContainer() {
    assertTrue(VaultScanner.scan(new SimulatedContainerNetwork(), "vault").isEmpty());
  }
}
