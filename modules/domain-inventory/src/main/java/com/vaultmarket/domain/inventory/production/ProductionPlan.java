package com.vaultmarket.domain.inventory.production;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What the production loop works with: the vault, item routes, returner containers that are
 * emptied back into the vault, and recipes. Holds each recipe's round-robin position. Not
 * thread-safe; callers serialize access the same way they do for the stores.
 */
public class ProductionPlan {
  private String vaultName;
  private boolean productionEnabled;
  private final Map<String, String> routes = new LinkedHashMap<>();
  private final Set<String> returners = new LinkedHashSet<>();
  private final Map<String, Recipe> recipes = new LinkedHashMap<>();
  private final Map<String, Integer> nextOutputIndex = new HashMap<>();

  public Optional<String> vaultName() {
    return Optional.ofNullable(vaultName);
  }

  public void setVaultName(String name) {
    this.vaultName = name == null || name.isBlank() ? null : name.trim();
  }

  public boolean productionEnabled() {
    return productionEnabled;
  }

  public void setProductionEnabled(boolean enabled) {
    this.productionEnabled = enabled;
  }

  public void putRoute(String item, String destination) {
    routes.put(requireName(item, "item"), requireName(destination, "destination"));
  }

  public boolean removeRoute(String item) {
    return item != null && routes.remove(item.trim()) != null;
  }

  public Optional<String> routeFor(String item) {
    return item == null ? Optional.empty() : Optional.ofNullable(routes.get(item.trim()));
  }

  public Map<String, String> routes() {
    return Collections.unmodifiableMap(routes);
  }

  public boolean addReturner(String container) {
    return returners.add(requireName(container, "container"));
  }

  public boolean removeReturner(String container) {
    return container != null && returners.remove(container.trim());
  }

  public List<String> returners() {
    return List.copyOf(returners);
  }

  /** Adds or replaces a recipe. Replacing restarts its output rotation. */
  public void putRecipe(Recipe recipe) {
    Objects.requireNonNull(recipe, "recipe must not be null");
    recipes.put(recipe.name(), recipe);
    nextOutputIndex.remove(recipe.name());
  }

  public boolean removeRecipe(String name) {
    if (name == null) {
      return false;
    }
    nextOutputIndex.remove(name.trim());
    return recipes.remove(name.trim()) != null;
  }

  public Optional<Recipe> recipe(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(recipes.get(name.trim()));
  }

  public List<Recipe> recipes() {
    return new ArrayList<>(recipes.values());
  }

  /** Output for the next run of the recipe, advancing its rotation. Empty when it has none. */
  public Optional<String> takeNextOutput(Recipe recipe) {
    List<String> outputs = recipe.outputs();
    if (outputs.isEmpty()) {
      return Optional.empty();
    }
    int index = nextOutputIndex.getOrDefault(recipe.name(), 0) % outputs.size();
    nextOutputIndex.put(recipe.name(), (index + 1) % outputs.size());
    return Optional.of(outputs.get(index));
  }

  private static String requireName(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value.trim();
  }
}
