package com.vaultmarket.domain.inventory.production;

import com.vaultmarket.domain.inventory.MoveResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one recipe run. {@code planned} is the batch that was due; {@code moves} is empty on
 * a dry run or when the run was refused, in which case {@code error} says why.
 */
public record RecipeRun(
    String recipe,
    String destination,
    boolean dryRun,
    Map<String, Integer> planned,
    List<MoveResult> moves,
    String error) {

  public RecipeRun {
    planned =
        planned == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(planned));
    moves = moves == null ? List.of() : List.copyOf(moves);
  }

  static RecipeRun refused(String recipe, String destination, boolean dryRun, String error) {
    return new RecipeRun(recipe, destination, dryRun, Map.of(), List.of(), error);
  }

  public boolean succeeded() {
    return error == null;
  }

  public int unitsMoved() {
    return moves.stream().mapToInt(MoveResult::moved).sum();
  }
}
