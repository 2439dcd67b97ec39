package com.vaultmarket.domain.ledger;

import com.vaultmarket.domain.common.ErrorCategory;
import java.util.Objects;

public class LedgerException extends RuntimeException {
  private final LedgerError error;

  public LedgerException(LedgerError error, String message) {
    super(message);
    this.error = Objects.requireNonNull(error, "error must not be null");
  }

  public LedgerError error() {
    return error;
  }

  public ErrorCategory category() {
    return error.category();
  }
}
