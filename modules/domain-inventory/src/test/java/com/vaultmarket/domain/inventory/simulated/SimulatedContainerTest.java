package com.vaultmarket.domain.inventory.simulated;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.vaultmarket.domain.inventory.ItemStack;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimulatedContainerTest {
  @Test
  void shouldFillExistingStacksBeforeEmptySlots() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork();
    SimulatedContainer chest = network.attach("chest", 3);

    chest.insert("widget", 10);
    chest.insert("widget", 60);

    Map<Integer, ItemStack> contents = chest.list();
    assertEquals(new ItemStack("widget", 64), contents.get(1));
    assertEquals(new ItemStack("widget", 6), contents.get(2));
  }

  @Test
  void shouldRejectOverflowBeyondCapacity() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork(16);
    SimulatedContainer chest = network.attach("chest", 2);

    assertEquals(32, chest.insert("widget", 40));
    assertEquals(0, chest.insert("gadget", 1));
  }

  @Test
  void shouldMoveOnlyWhatDestinationAccepts() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork(16);
    SimulatedContainer source = network.attach("source", 2);
    SimulatedContainer target = network.attach("target", 1);
    source.insert("widget", 16);
    target.insert("widget", 10);

    assertEquals(6, source.moveUnits("target", 1, 16));
    assertEquals(10, source.countOf("widget"));
    assertEquals(16, target.countOf("widget"));
    assertEquals(0, source.moveUnits("nowhere", 1, 1));
    assertEquals(0, source.moveUnits("target", 9, 1));
  }

  @Test
  void shouldExtractAcrossSlots() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork(8);
    SimulatedContainer chest = network.attach("chest", 4);
    chest.insert("widget", 20);

    assertEquals(12, chest.extract("widget", 12));
    assertEquals(8, chest.countOf("widget"));
  }

  @Test
  void shouldRefuseDuplicateNames() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork();
    network.attach("vault", 1);

    assertThrows(IllegalArgumentException.class, () -> network.attach("vault", 1));
  }
}
