package com.vaultmarket.domain.settlement;

import com.vaultmarket.domain.common.ErrorCategory;
import java.time.Instant;
import java.util.Objects;

public record SettlementResult(
    String settlementId,
    SettlementState state,
    long listingId,
    String buyer,
    String item,
    int requested,
    int delivered,
    int recovered,
    long unitPrice,
    long totalCharged,
    Long referencePrice,
    String errorCode,
    ErrorCategory category,
    String message,
    Instant completedAt) {
  public SettlementResult {
    Objects.requireNonNull(settlementId, "settlementId must not be null");
    Objects.requireNonNull(state, "state must not be null");
    if (!state.isTerminal()) {
      throw new SettlementDomainException("settlement result must be terminal: " + state);
    }
    Objects.requireNonNull(completedAt, "completedAt must not be null");
  }

  public boolean ok() {
    return state == SettlementState.SETTLED;
  }

  public int unrecovered() {
    return state == SettlementState.CHARGE_FAILED_UNRECOVERED ? delivered - recovered : 0;
  }
}
