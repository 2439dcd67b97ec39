package com.vaultmarket.domain.settlement;

public enum SettlementState {
  QUOTED,
  DELIVERING,
  CHARGING,
  SETTLED,
  DELIVERY_FAILED,
  CHARGE_FAILED_COMPENSATING,
  REVERTED,
  CHARGE_FAILED_UNRECOVERED;

  public boolean isTerminal() {
    return this == SETTLED
        || this == DELIVERY_FAILED
        || this == REVERTED
        || this == CHARGE_FAILED_UNRECOVERED;
  }
}
