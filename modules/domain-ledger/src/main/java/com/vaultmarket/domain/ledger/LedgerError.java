package com.vaultmarket.domain.ledger;

import com.vaultmarket.domain.common.ErrorCategory;

public enum LedgerError {
  INVALID_REQUEST(ErrorCategory.VALIDATION),
  ALREADY_EXISTS(ErrorCategory.VALIDATION),
  TRANSFER_ID_CONFLICT(ErrorCategory.VALIDATION),
  NOT_FOUND(ErrorCategory.AUTHORIZATION),
  BAD_CREDENTIAL(ErrorCategory.AUTHORIZATION),
  NOT_APPROVED(ErrorCategory.AUTHORIZATION),
  UNKNOWN_ACCOUNT(ErrorCategory.AUTHORIZATION),
  INSUFFICIENT_FUNDS(ErrorCategory.INSUFFICIENT_RESOURCE);

  private final ErrorCategory category;

  LedgerError(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
