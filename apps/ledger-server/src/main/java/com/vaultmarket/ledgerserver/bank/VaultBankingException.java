package com.vaultmarket.ledgerserver.bank;

import com.vaultmarket.domain.common.ErrorCategory;
import java.util.Objects;

public class VaultBankingException extends RuntimeException {
  private final VaultBankingError error;

  public VaultBankingException(VaultBankingError error, String message) {
    super(message);
    this.error = Objects.requireNonNull(error, "error must not be null");
  }

  public VaultBankingError error() {
    return error;
  }

  public ErrorCategory category() {
    return error.category();
  }
}
