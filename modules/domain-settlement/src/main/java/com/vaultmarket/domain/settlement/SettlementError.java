package com.vaultmarket.domain.settlement;

import com.vaultmarket.domain.common.ErrorCategory;

public enum SettlementError {
  INVALID_REQUEST(ErrorCategory.VALIDATION),
  LISTING_NOT_FOUND(ErrorCategory.VALIDATION),
  OWN_LISTING(ErrorCategory.VALIDATION),
  NOT_AVAILABLE(ErrorCategory.INSUFFICIENT_RESOURCE),
  OUT_OF_STOCK(ErrorCategory.INSUFFICIENT_RESOURCE),
  NOTHING_DELIVERED(ErrorCategory.INSUFFICIENT_RESOURCE),
  VAULT_UNAVAILABLE(ErrorCategory.INTERNAL),
  UNRECOVERED_INCONSISTENCY(ErrorCategory.UNRECOVERED_INCONSISTENCY);

  private final ErrorCategory category;

  SettlementError(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
