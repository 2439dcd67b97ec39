package com.vaultmarket.domain.inventory.production;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.MoveResult;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProductionRunnerTest {
  private SimulatedContainerNetwork network;
  private SimulatedContainer vault;
  private SimulatedContainer furnaceA;
  private SimulatedContainer furnaceB;
  private ProductionPlan plan;
  private ProductionRunner runner;

  @BeforeEach
  void setUp() {
    network = new SimulatedContainerNetwork();
    vault = network.attach("vault", 27);
    furnaceA = network.attach("furnace_a", 9);
    furnaceB = network.attach("furnace_b", 9);
    plan = new ProductionPlan();
    plan.setVaultName("vault");
    runner = new ProductionRunner(network, new InventoryMover(network), plan);
  }

  @Test
  void shouldSweepEveryItemFromReturnersIntoVault() {
    SimulatedContainer returner = network.attach("machine_1", 9);
    returner.insert("ingot", 70);
    returner.insert("slag", 3);
    plan.addReturner("machine_1");

    int moved = runner.sweepReturners();

    assertEquals(73, moved);
    assertEquals(0, returner.countOf("ingot"));
    assertEquals(70, vault.countOf("ingot"));
    assertEquals(3, vault.countOf("slag"));
  }

  @Test
  void shouldSkipSweepWithoutVault() {
    SimulatedContainer returner = network.attach("machine_1", 9);
    returner.insert("ingot", 5);
    plan.addReturner("machine_1");
    plan.setVaultName(null);

    assertEquals(0, runner.sweepReturners());
    assertEquals(5, returner.countOf("ingot"));
  }

  @Test
  void shouldRotateOutputsOnEachRun() {
    vault.insert("ore", 40);
    plan.putRecipe(
        new Recipe("smelt", RecipeMode.COUNT, Map.of("ore", 8), List.of("furnace_a", "furnace_b")));

    RecipeRun first = runner.runRecipe("smelt", false);
    RecipeRun second = runner.runRecipe("smelt", false);
    RecipeRun third = runner.runRecipe("smelt", false);

    assertEquals("furnace_a", first.destination());
    assertEquals("furnace_b", second.destination());
    assertEquals("furnace_a", third.destination());
    assertEquals(16, furnaceA.countOf("ore"));
    assertEquals(8, furnaceB.countOf("ore"));
    assertEquals(16, vault.countOf("ore"));
  }

  @Test
  void shouldPlanWithoutMovingOnDryRun() {
    vault.insert("ore", 40);
    plan.putRecipe(new Recipe("smelt", RecipeMode.COUNT, Map.of("ore", 8), List.of("furnace_a")));

    RecipeRun run = runner.runRecipe("smelt", true);

    assertTrue(run.succeeded());
    assertTrue(run.dryRun());
    assertEquals(Map.of("ore", 8), run.planned());
    assertTrue(run.moves().isEmpty());
    assertEquals(40, vault.countOf("ore"));
    assertEquals(0, furnaceA.countOf("ore"));
  }

  @Test
  void shouldReportShortMovesWhenVaultRunsLow() {
    vault.insert("sand", 10);
    Map<String, Integer> items = new LinkedHashMap<>();
    items.put("sand", 3);
    items.put("gravel", 1);
    plan.putRecipe(new Recipe("mix", RecipeMode.PERCENT, items, List.of("furnace_a")));

    RecipeRun run = runner.runRecipe("mix", false);

    assertTrue(run.succeeded());
    assertEquals(Map.of("sand", 48, "gravel", 16), run.planned());
    assertEquals(10, run.unitsMoved());
    assertTrue(run.moves().stream().allMatch(MoveResult::isShort));
    assertEquals(10, furnaceA.countOf("sand"));
  }

  @Test
  void shouldRefuseRecipeWithoutOutputsOrMissingOutput() {
    vault.insert("ore", 10);
    plan.putRecipe(new Recipe("lonely", RecipeMode.COUNT, Map.of("ore", 1), List.of()));
    plan.putRecipe(new Recipe("lost", RecipeMode.COUNT, Map.of("ore", 1), List.of("nowhere")));

    RecipeRun lonely = runner.runRecipe("lonely", false);
    RecipeRun lost = runner.runRecipe("lost", false);

    assertEquals("Recipe has no outputs", lonely.error());
    assertEquals("Output missing: nowhere", lost.error());
    assertEquals(10, vault.countOf("ore"));
  }

  @Test
  void shouldRefusePercentRecipeWithNoWeight() {
    plan.putRecipe(
        new Recipe("idle", RecipeMode.PERCENT, Map.of("sand", 0), List.of("furnace_a")));

    RecipeRun run = runner.runRecipe("idle", false);

    assertFalse(run.succeeded());
    assertEquals("Recipe weights must add up to more than 0", run.error());
  }

  @Test
  void shouldRunCycleOnlyWhileProductionIsEnabled() {
    vault.insert("ore", 10);
    plan.putRecipe(new Recipe("smelt", RecipeMode.COUNT, Map.of("ore", 2), List.of("furnace_a")));

    assertTrue(runner.runProductionCycle().isEmpty());
    assertEquals(0, furnaceA.countOf("ore"));

    plan.setProductionEnabled(true);
    List<RecipeRun> runs = runner.runProductionCycle();

    assertEquals(1, runs.size());
    assertEquals(2, furnaceA.countOf("ore"));
  }

  @Test
  void shouldDispatchRoutedItemFromVault() {
    vault.insert("glass", 20);
    plan.putRoute("glass", "furnace_b");

    MoveResult routed = runner.dispatch("glass", 5);
    MoveResult unrouted = runner.dispatch("brick", 5);

    assertEquals(5, routed.moved());
    assertEquals(5, furnaceB.countOf("glass"));
    assertEquals(0, unrouted.moved());
    assertEquals("No route for brick", unrouted.note());
  }

  @Test
  void shouldRestartRotationWhenRecipeIsReplaced() {
    vault.insert("ore", 10);
    Recipe recipe =
        new Recipe("smelt", RecipeMode.COUNT, Map.of("ore", 1), List.of("furnace_a", "furnace_b"));
    plan.putRecipe(recipe);
    runner.runRecipe("smelt", true);

    plan.putRecipe(recipe.withOutputs(List.of("furnace_b", "furnace_a")));

    assertEquals("furnace_b", runner.runRecipe("smelt", true).destination());
  }
}
