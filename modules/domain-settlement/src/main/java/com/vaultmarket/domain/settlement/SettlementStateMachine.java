package com.vaultmarket.domain.settlement;

import java.util.EnumSet;
import java.util.Map;

public final class SettlementStateMachine {
  private static final Map<SettlementState, EnumSet<SettlementState>> ALLOWED_TRANSITIONS =
      Map.of(
          SettlementState.QUOTED,
              EnumSet.of(SettlementState.DELIVERING, SettlementState.DELIVERY_FAILED),
          SettlementState.DELIVERING,
              EnumSet.of(SettlementState.CHARGING, SettlementState.DELIVERY_FAILED),
          SettlementState.CHARGING,
              EnumSet.of(SettlementState.SETTLED, SettlementState.CHARGE_FAILED_COMPENSATING),
          SettlementState.CHARGE_FAILED_COMPENSATING,
              EnumSet.of(SettlementState.REVERTED, SettlementState.CHARGE_FAILED_UNRECOVERED),
          SettlementState.SETTLED, EnumSet.noneOf(SettlementState.class),
          SettlementState.DELIVERY_FAILED, EnumSet.noneOf(SettlementState.class),
          SettlementState.REVERTED, EnumSet.noneOf(SettlementState.class),
          SettlementState.CHARGE_FAILED_UNRECOVERED, EnumSet.noneOf(SettlementState.class));

  private SettlementStateMachine() {}

  public static boolean canTransition(SettlementState from, SettlementState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<SettlementState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(SettlementState from, SettlementState to) {
    if (!canTransition(from, to)) {
      throw new SettlementDomainException(
          "Invalid settlement state transition from " + from + " to " + to);
    }
  }
}
