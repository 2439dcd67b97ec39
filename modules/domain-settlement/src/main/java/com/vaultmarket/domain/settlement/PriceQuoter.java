package com.vaultmarket.domain.settlement;

import java.util.OptionalLong;

/** Market reference price for an item at the live vault stock; informational only. */
@FunctionalInterface
public interface PriceQuoter {
  OptionalLong quote(String item, int vaultStock);

  static PriceQuoter none() {
    return (item, vaultStock) -> OptionalLong.empty();
  }
}
