package com.vaultmarket.ledgerserver.bank;

import com.vaultmarket.domain.common.ErrorCategory;

public enum VaultBankingError {
  VAULT_NOT_CONFIGURED(ErrorCategory.INTERNAL),
  CONTAINER_UNAVAILABLE(ErrorCategory.INTERNAL),
  NOT_PRICED(ErrorCategory.VALIDATION),
  INSUFFICIENT_STOCK(ErrorCategory.INSUFFICIENT_RESOURCE),
  NOTHING_MOVED(ErrorCategory.INSUFFICIENT_RESOURCE);

  private final ErrorCategory category;

  VaultBankingError(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
