package com.vaultmarket.domain.inventory.production;

public enum RecipeMode {
  /** Each item amount is a literal unit count pushed per run. */
  COUNT,
  /** Each item amount is a weight; a run splits {@link Recipe#PERCENT_BATCH} units by weight. */
  PERCENT
}
