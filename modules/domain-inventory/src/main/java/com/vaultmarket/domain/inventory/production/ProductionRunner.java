package com.vaultmarket.domain.inventory.production;

import com.vaultmarket.domain.inventory.ContainerNetwork;
import com.vaultmarket.domain.inventory.InventoryContainer;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.MoveResult;
import com.vaultmarket.domain.inventory.VaultScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries out a {@link ProductionPlan} against a container network: empties returners into the
 * vault, dispatches routed items and runs recipes. Each call is a single pass; whatever schedules
 * the passes lives outside this class. Every transfer goes through {@link InventoryMover}, so
 * short counts are reported and never retried here.
 */
public class ProductionRunner {
  private static final Logger log = LoggerFactory.getLogger(ProductionRunner.class);

  private final ContainerNetwork network;
  private final InventoryMover mover;
  private final ProductionPlan plan;

  public ProductionRunner(ContainerNetwork network, InventoryMover mover, ProductionPlan plan) {
    this.network = Objects.requireNonNull(network, "network must not be null");
    this.mover = Objects.requireNonNull(mover, "mover must not be null");
    this.plan = Objects.requireNonNull(plan, "plan must not be null");
  }

  /** Moves everything the returner holds into the vault. Returns the units moved. */
  public int sweepReturner(String name) {
    Optional<InventoryContainer> vault = plan.vaultName().flatMap(network::find);
    Optional<InventoryContainer> returner = network.find(name);
    if (vault.isEmpty() || returner.isEmpty()) {
      log.debug("Skipping sweep returner={} vaultPresent={}", name, vault.isPresent());
      return 0;
    }
    int moved = 0;
    for (Map.Entry<String, Integer> stock : VaultScanner.scan(returner.get()).counts().entrySet()) {
      moved += mover.move(returner.get(), vault.get(), stock.getKey(), stock.getValue()).moved();
    }
    if (moved > 0) {
      log.info("Swept returner={} into vault={} units={}", name, vault.get().name(), moved);
    }
    return moved;
  }

  public int sweepReturners() {
    int moved = 0;
    for (String returner : plan.returners()) {
      moved += sweepReturner(returner);
    }
    return moved;
  }

  /** Pushes up to {@code count} units of a routed item from the vault to its destination. */
  public MoveResult dispatch(String item, int count) {
    Optional<String> destination = plan.routeFor(item);
    if (destination.isEmpty()) {
      return MoveResult.nothing(item, count, "No route for " + item);
    }
    Optional<String> vault = plan.vaultName();
    if (vault.isEmpty()) {
      return MoveResult.nothing(item, count, "No vault configured");
    }
    return mover.move(vault.get(), destination.get(), item, count);
  }

  /**
   * Runs one batch of the recipe into its next output. A dry run works out the batch and advances
   * the output rotation but moves nothing.
   */
  public RecipeRun runRecipe(String name, boolean dryRun) {
    Optional<Recipe> found = plan.recipe(name);
    if (found.isEmpty()) {
      return RecipeRun.refused(name, null, dryRun, "Unknown recipe: " + name);
    }
    Recipe recipe = found.get();
    Optional<String> vaultName = plan.vaultName();
    if (vaultName.isEmpty()) {
      return refuse(recipe, null, dryRun, "No vault configured");
    }
    if (network.find(vaultName.get()).isEmpty()) {
      return refuse(recipe, null, dryRun, "Vault container missing: " + vaultName.get());
    }
    Optional<String> output = plan.takeNextOutput(recipe);
    if (output.isEmpty()) {
      return refuse(recipe, null, dryRun, "Recipe has no outputs");
    }
    String destination = output.get();
    if (network.find(destination).isEmpty()) {
      return refuse(recipe, destination, dryRun, "Output missing: " + destination);
    }
    if (recipe.mode() == RecipeMode.PERCENT && !recipe.hasWeight()) {
      return refuse(recipe, destination, dryRun, "Recipe weights must add up to more than 0");
    }

    Map<String, Integer> batch = recipe.batch();
    if (dryRun) {
      batch.forEach(
          (item, amount) ->
              log.info(
                  "Dry run recipe={} item={} amount={} destination={}",
                  recipe.name(),
                  item,
                  amount,
                  destination));
      return new RecipeRun(recipe.name(), destination, true, batch, List.of(), null);
    }

    List<MoveResult> moves = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : batch.entrySet()) {
      MoveResult result =
          mover.move(vaultName.get(), destination, entry.getKey(), entry.getValue());
      if (result.movedAnything()) {
        log.info(
            "Pushed recipe={} item={} moved={} destination={}",
            recipe.name(),
            entry.getKey(),
            result.moved(),
            destination);
      }
      moves.add(result);
    }
    return new RecipeRun(recipe.name(), destination, false, batch, moves, null);
  }

  public List<RecipeRun> runAllRecipes(boolean dryRun) {
    List<RecipeRun> runs = new ArrayList<>();
    for (Recipe recipe : plan.recipes()) {
      runs.add(runRecipe(recipe.name(), dryRun));
    }
    return runs;
  }

  /** One tick of the production loop: every recipe once, only while production is enabled. */
  public List<RecipeRun> runProductionCycle() {
    if (!plan.productionEnabled()) {
      return List.of();
    }
    return runAllRecipes(false);
  }

  private static RecipeRun refuse(Recipe recipe, String destination, boolean dryRun, String error) {
    log.warn(
        "Recipe refused recipe={} destination={} reason={}", recipe.name(), destination, error);
    return RecipeRun.refused(recipe.name(), destination, dryRun, error);
  }
}
