package com.vaultmarket.domain.settlement;

import com.vaultmarket.domain.common.ErrorCategory;
import java.util.Objects;

public record ChargeOutcome(
    ChargeStatus status, String errorCode, ErrorCategory category, String message) {
  public ChargeOutcome {
    Objects.requireNonNull(status, "status must not be null");
  }

  public static ChargeOutcome applied() {
    return new ChargeOutcome(ChargeStatus.APPLIED, null, null, null);
  }

  public static ChargeOutcome rejected(String errorCode, ErrorCategory category, String message) {
    return new ChargeOutcome(
        ChargeStatus.REJECTED,
        Objects.requireNonNull(errorCode, "errorCode must not be null"),
        category == null ? ErrorCategory.INTERNAL : category,
        message);
  }

  public static ChargeOutcome unknown(String errorCode, String message) {
    return new ChargeOutcome(
        ChargeStatus.UNKNOWN, errorCode, ErrorCategory.TRANSPORT_AMBIGUITY, message);
  }

  public boolean isApplied() {
    return status == ChargeStatus.APPLIED;
  }
}
