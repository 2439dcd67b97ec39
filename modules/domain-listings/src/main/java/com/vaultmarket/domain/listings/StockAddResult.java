package com.vaultmarket.domain.listings;

import com.vaultmarket.domain.inventory.MoveResult;

public record StockAddResult(Listing listing, MoveResult move) {
  public int moved() {
    return move.moved();
  }
}
